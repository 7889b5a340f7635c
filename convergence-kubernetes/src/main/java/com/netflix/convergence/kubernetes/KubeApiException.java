/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.convergence.kubernetes;

import io.kubernetes.client.openapi.ApiException;

public class KubeApiException extends RuntimeException {

    private static final String NOT_FOUND = "Not Found";

    public enum ErrorCode {
        CONFLICT_ALREADY_EXISTS,
        FORBIDDEN,
        INTERNAL,
        NOT_FOUND,
        UNAVAILABLE,
    }

    private final ErrorCode errorCode;

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = cause instanceof ApiException ? toErrorCode((ApiException) cause) : ErrorCode.INTERNAL;
    }

    public KubeApiException(ApiException cause) {
        this(String.format("%s: httpStatus=%s, body=%s", cause.getMessage(), cause.getCode(), cause.getResponseBody()), cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    private static ErrorCode toErrorCode(ApiException e) {
        switch (e.getCode()) {
            case 404:
                return ErrorCode.NOT_FOUND;
            case 409:
                return ErrorCode.CONFLICT_ALREADY_EXISTS;
            case 401:
            case 403:
                return ErrorCode.FORBIDDEN;
            default:
                if (NOT_FOUND.equalsIgnoreCase(e.getMessage())) {
                    return ErrorCode.NOT_FOUND;
                }
                // No HTTP status means the request never reached the API server.
                return e.getCode() == 0 ? ErrorCode.UNAVAILABLE : ErrorCode.INTERNAL;
        }
    }
}
