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

package com.netflix.convergence.api.service;

import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;

import static java.lang.String.format;

public class ResourceStoreException extends RuntimeException {

    public enum ErrorCode {
        NotFound,
        AlreadyExists,
        Forbidden,
        Unavailable,
        UnsupportedType,
        Internal
    }

    private final ErrorCode errorCode;

    private ResourceStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true, if the argument is a {@link ResourceStoreException} reporting absence of a single object.
     * Absence is an expected outcome of a lookup, and is never surfaced as a reconciliation error.
     */
    public static boolean isNotFound(Throwable error) {
        return hasErrorCode(error, ErrorCode.NotFound);
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof ResourceStoreException) && ((ResourceStoreException) error).getErrorCode() == errorCode;
    }

    public static ResourceStoreException notFound(ObjectType<?> type, ObjectIdentity identity) {
        return new ResourceStoreException(ErrorCode.NotFound, format("%s %s not found", type, identity), null);
    }

    public static ResourceStoreException alreadyExists(ObjectType<?> type, ObjectIdentity identity) {
        return new ResourceStoreException(ErrorCode.AlreadyExists, format("%s %s already exists", type, identity), null);
    }

    public static ResourceStoreException unsupportedType(ObjectType<?> type) {
        return new ResourceStoreException(ErrorCode.UnsupportedType, format("Object type %s not supported by the store", type), null);
    }

    public static ResourceStoreException unavailable(String message, Throwable cause) {
        return new ResourceStoreException(ErrorCode.Unavailable, message, cause);
    }

    public static ResourceStoreException internal(String message, Throwable cause) {
        return new ResourceStoreException(ErrorCode.Internal, message, cause);
    }

    public static ResourceStoreException of(ErrorCode errorCode, String message, Throwable cause) {
        return new ResourceStoreException(errorCode, message, cause);
    }
}
