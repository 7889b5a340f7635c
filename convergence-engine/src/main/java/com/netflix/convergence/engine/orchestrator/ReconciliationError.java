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

package com.netflix.convergence.engine.orchestrator;

import java.util.Objects;
import java.util.Optional;

import com.netflix.convergence.api.model.ActionKind;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ReconcileAction;

/**
 * A failure recorded during a reconciliation pass, attributed to the manager it happened in. The message keeps
 * the original store error text.
 */
public final class ReconciliationError {

    public enum ErrorKind {
        /**
         * Computing the required or deployed objects failed. The manager produced no actions.
         */
        BackendFailure,

        /**
         * Unregistered type or duplicate identity. The pass was aborted.
         */
        ConfigurationError,

        /**
         * A single action was rejected by the store. Other actions were still attempted.
         */
        ActionFailure
    }

    private final String managerName;
    private final ErrorKind kind;
    private final Optional<ObjectType<?>> objectType;
    private final Optional<ObjectIdentity> identity;
    private final Optional<ActionKind> actionKind;
    private final String message;
    private final Throwable cause;

    private ReconciliationError(String managerName,
                                ErrorKind kind,
                                Optional<ObjectType<?>> objectType,
                                Optional<ObjectIdentity> identity,
                                Optional<ActionKind> actionKind,
                                String message,
                                Throwable cause) {
        this.managerName = managerName;
        this.kind = kind;
        this.objectType = objectType;
        this.identity = identity;
        this.actionKind = actionKind;
        this.message = message;
        this.cause = cause;
    }

    public String getManagerName() {
        return managerName;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<ObjectType<?>> getObjectType() {
        return objectType;
    }

    public Optional<ObjectIdentity> getIdentity() {
        return identity;
    }

    public Optional<ActionKind> getActionKind() {
        return actionKind;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconciliationError that = (ReconciliationError) o;
        return Objects.equals(managerName, that.managerName) &&
                kind == that.kind &&
                Objects.equals(objectType, that.objectType) &&
                Objects.equals(identity, that.identity) &&
                Objects.equals(actionKind, that.actionKind) &&
                Objects.equals(message, that.message) &&
                Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(managerName, kind, objectType, identity, actionKind, message, cause);
    }

    @Override
    public String toString() {
        return "ReconciliationError{" +
                "managerName='" + managerName + '\'' +
                ", kind=" + kind +
                ", objectType=" + objectType.map(ObjectType::getName).orElse("none") +
                ", identity=" + identity.map(ObjectIdentity::toString).orElse("none") +
                ", actionKind=" + actionKind.map(Enum::name).orElse("none") +
                ", message='" + message + '\'' +
                '}';
    }

    public static ReconciliationError backendFailure(String managerName, String operation, Throwable cause) {
        return new ReconciliationError(managerName, ErrorKind.BackendFailure, Optional.empty(), Optional.empty(), Optional.empty(),
                String.format("Cannot compute %s: %s", operation, cause.getMessage()), cause);
    }

    public static ReconciliationError configurationError(String managerName, Throwable cause) {
        return new ReconciliationError(managerName, ErrorKind.ConfigurationError, Optional.empty(), Optional.empty(), Optional.empty(),
                cause.getMessage(), cause);
    }

    public static ReconciliationError actionFailure(String managerName, ReconcileAction action, Throwable cause) {
        return new ReconciliationError(managerName, ErrorKind.ActionFailure,
                Optional.of(action.getType()), Optional.of(action.getIdentity()), Optional.of(action.getKind()),
                String.format("%s failed: %s", action, cause.getMessage()), cause);
    }
}
