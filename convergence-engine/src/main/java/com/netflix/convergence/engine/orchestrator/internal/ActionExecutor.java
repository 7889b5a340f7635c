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

package com.netflix.convergence.engine.orchestrator.internal;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ReconcileAction;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.api.service.ResourceStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a single action to the resource store.
 */
class ActionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ActionExecutor.class);

    private final ResourceStore store;

    ActionExecutor(ResourceStore store) {
        this.store = store;
    }

    /**
     * @throws ResourceStoreException if the store rejects the action. Deleting an object that is already gone is
     *                                not an error.
     */
    void execute(ReconcileAction action) {
        switch (action.getKind()) {
            case Create:
                store.create(requireObject(action));
                break;
            case Update:
                store.update(requireObject(action));
                break;
            case Delete:
                try {
                    store.delete(action.getType(), action.getIdentity());
                } catch (ResourceStoreException e) {
                    if (!ResourceStoreException.isNotFound(e)) {
                        throw e;
                    }
                    logger.debug("Object already removed: {} {}", action.getType(), action.getIdentity());
                }
                break;
            default:
                throw new IllegalStateException("Unknown action kind: " + action.getKind());
        }
    }

    private ManagedObject<?> requireObject(ReconcileAction action) {
        return action.getObject().orElseThrow(() -> new IllegalStateException("Action without object: " + action));
    }
}
