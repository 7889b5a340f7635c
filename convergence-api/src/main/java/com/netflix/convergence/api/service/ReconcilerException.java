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

/**
 * Configuration or programming defect detected during a reconciliation pass. Unlike store failures it is not
 * transient, so it aborts the whole pass.
 */
public class ReconcilerException extends RuntimeException {

    public enum ErrorCode {
        UnregisteredObjectType,
        ConflictingObjectType,
        DuplicateIdentity,
        DuplicateManager
    }

    private final ErrorCode errorCode;

    private ReconcilerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof ReconcilerException) && ((ReconcilerException) error).getErrorCode() == errorCode;
    }

    public static ReconcilerException unregisteredObjectType(ObjectType<?> type) {
        return new ReconcilerException(ErrorCode.UnregisteredObjectType, format("Object type %s has no registered descriptor", type));
    }

    public static ReconcilerException conflictingObjectType(ObjectType<?> type) {
        return new ReconcilerException(ErrorCode.ConflictingObjectType, format("Object type %s registered with two different descriptors", type));
    }

    public static ReconcilerException duplicateIdentity(String setName, ObjectType<?> type, ObjectIdentity identity) {
        return new ReconcilerException(ErrorCode.DuplicateIdentity, format("Duplicate %s object %s %s", setName, type, identity));
    }

    public static ReconcilerException duplicateManager(String managerName) {
        return new ReconcilerException(ErrorCode.DuplicateManager, format("Resource manager %s registered twice", managerName));
    }
}
