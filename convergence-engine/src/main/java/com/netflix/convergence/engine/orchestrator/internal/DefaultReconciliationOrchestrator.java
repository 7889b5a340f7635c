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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconcileAction;
import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.service.ReconcilerException;
import com.netflix.convergence.api.service.ResourceManager;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.common.config.ConfigurationProxies;
import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import com.netflix.convergence.common.runtime.ConvergenceRuntimes;
import com.netflix.convergence.engine.diff.DiffEngine;
import com.netflix.convergence.engine.diff.internal.DefaultDiffEngine;
import com.netflix.convergence.engine.orchestrator.CancellationSignal;
import com.netflix.convergence.engine.orchestrator.ManagerResult;
import com.netflix.convergence.engine.orchestrator.ReconcilerConfiguration;
import com.netflix.convergence.engine.orchestrator.ReconciliationError;
import com.netflix.convergence.engine.orchestrator.ReconciliationOrchestrator;
import com.netflix.convergence.engine.orchestrator.ReconciliationOutcome;
import com.netflix.convergence.engine.registry.ComparatorRegistry;
import com.netflix.spectator.api.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

public class DefaultReconciliationOrchestrator<S> implements ReconciliationOrchestrator<S> {

    private static final Logger logger = LoggerFactory.getLogger(DefaultReconciliationOrchestrator.class);

    private final List<ResourceManager<S>> managers;
    private final ComparatorRegistry registry;
    private final DiffEngine diffEngine;
    private final ActionExecutor executor;
    private final ReconcilerConfiguration configuration;
    private final Scheduler managerScheduler;
    private final Scheduler passScheduler;
    private final List<Scheduler> ownedSchedulers;
    private final Clock clock;
    private final ReconciliationMetrics metrics;

    private DefaultReconciliationOrchestrator(List<ResourceManager<S>> managers,
                                              ComparatorRegistry registry,
                                              ResourceStore store,
                                              ReconcilerConfiguration configuration,
                                              Scheduler managerScheduler,
                                              Scheduler passScheduler,
                                              List<Scheduler> ownedSchedulers,
                                              ConvergenceRuntime runtime) {
        this.managers = managers;
        this.registry = registry;
        this.diffEngine = new DefaultDiffEngine(registry);
        this.executor = new ActionExecutor(store);
        this.configuration = configuration;
        this.managerScheduler = managerScheduler;
        this.passScheduler = passScheduler;
        this.ownedSchedulers = ownedSchedulers;
        this.clock = runtime.getClock();
        this.metrics = new ReconciliationMetrics(runtime);
    }

    @Override
    public List<ResourceManager<S>> getManagers() {
        return managers;
    }

    public ComparatorRegistry getRegistry() {
        return registry;
    }

    @Override
    public ReconciliationOutcome reconcile(ReconciliationTarget<S> target, CancellationSignal cancellation) {
        long startTimeNs = clock.monotonicTime();
        long deadline = clock.wallTime() + configuration.getPassTimeoutMs();
        BooleanSupplier stopRequested = () -> cancellation.isCancelled() || clock.wallTime() > deadline;
        AtomicBoolean aborted = new AtomicBoolean();

        int concurrency = Math.max(1, configuration.getManagerConcurrency());
        List<ManagerResult> results;
        if (concurrency == 1 || managers.size() < 2) {
            results = new ArrayList<>();
            for (ResourceManager<S> manager : managers) {
                results.add(runManager(manager, target, stopRequested, aborted));
            }
        } else {
            // flatMapSequential emits in registration order, whatever order the managers complete in.
            results = Flux.fromIterable(managers)
                    .flatMapSequential(
                            manager -> Mono.fromCallable(() -> runManager(manager, target, stopRequested, aborted)).subscribeOn(managerScheduler),
                            concurrency
                    )
                    .collectList()
                    .block();
        }

        long elapsedNs = clock.monotonicTime() - startTimeNs;
        ReconciliationOutcome outcome = ReconciliationOutcome.of(target.getIdentity(), results, TimeUnit.NANOSECONDS.toMillis(elapsedNs));
        metrics.passCompleted(outcome, elapsedNs);

        if (outcome.getStatus() == ReconciliationOutcome.Status.Completed) {
            logger.info("[{}] Reconciliation pass completed: attempted={}, applied={}, elapsedMs={}",
                    target.getIdentity(), outcome.getAttemptedCount(), outcome.getAppliedCount(), outcome.getDurationMs());
        } else {
            logger.warn("[{}] Reconciliation pass finished with status {}: attempted={}, applied={}, errors={}",
                    target.getIdentity(), outcome.getStatus(), outcome.getAttemptedCount(), outcome.getAppliedCount(), outcome.getErrors());
        }
        return outcome;
    }

    @Override
    public Mono<ReconciliationOutcome> reconcileAsync(ReconciliationTarget<S> target) {
        return Mono.defer(() -> {
            CancellationSignal cancellation = CancellationSignal.newSignal();
            return Mono.fromCallable(() -> reconcile(target, cancellation)).doOnCancel(cancellation::cancel);
        }).subscribeOn(passScheduler);
    }

    @Override
    public void shutdown() {
        metrics.shutdown();
        ownedSchedulers.forEach(Scheduler::dispose);
    }

    private ManagerResult runManager(ResourceManager<S> manager,
                                     ReconciliationTarget<S> target,
                                     BooleanSupplier stopRequested,
                                     AtomicBoolean aborted) {
        String name = manager.getName();
        if (aborted.get() || stopRequested.getAsBoolean()) {
            logger.info("[{}] Skipping resource manager {}: aborted={}", target.getIdentity(), name, aborted.get());
            return ManagerResult.skipped(name);
        }

        List<ManagedObject<?>> required;
        try {
            required = manager.getRequiredObjects(target);
        } catch (RuntimeException e) {
            return failure(name, "required objects", e, aborted);
        }

        List<ManagedObject<?>> deployed;
        try {
            deployed = manager.getDeployedObjects(target);
        } catch (RuntimeException e) {
            return failure(name, "deployed objects", e, aborted);
        }

        List<ReconcileAction> actions;
        try {
            OwnershipScope scope = manager.getOwnershipScope(target);
            ComparatorOverrides overrides = manager.getCustomComparators();
            actions = diffEngine.diff(required, deployed, scope, overrides);
        } catch (RuntimeException e) {
            return failure(name, "actions", e, aborted);
        }

        logger.debug("[{}] Resource manager {} planned actions: {}", target.getIdentity(), name, actions);
        return execute(name, actions, stopRequested);
    }

    private ManagerResult execute(String name, List<ReconcileAction> actions, BooleanSupplier stopRequested) {
        ManagerResult.Builder result = ManagerResult.newBuilder(name)
                .withState(ManagerResult.State.Completed)
                .withPlannedActions(actions);

        boolean dryRun = configuration.isDryRunEnabled();
        for (int i = 0; i < actions.size(); i++) {
            ReconcileAction action = actions.get(i);
            if (stopRequested.getAsBoolean()) {
                logger.info("Pass cancelled or timed out, {} of {} actions of resource manager {} not attempted", actions.size() - i, actions.size(), name);
                result.withState(ManagerResult.State.Cancelled);
                break;
            }

            result.withAttempted(action);
            if (dryRun) {
                logger.info("[{}] Dry run, not executing {}", name, action);
                metrics.actionSkipped(name, action);
                continue;
            }
            try {
                executor.execute(action);
                result.withApplied(action);
                metrics.actionApplied(name, action);
                logger.info("[{}] Applied {}", name, action);
            } catch (RuntimeException e) {
                ReconciliationError error = ReconciliationError.actionFailure(name, action, e);
                result.withError(error);
                metrics.actionFailed(name, action);
                metrics.error(error);
                logger.warn("[{}] {}", name, error.getMessage());
                logger.debug("[{}] Action failure details", name, e);
            }
        }
        return result.build();
    }

    private ManagerResult failure(String name, String operation, RuntimeException cause, AtomicBoolean aborted) {
        if (cause instanceof ReconcilerException) {
            aborted.set(true);
            ReconciliationError error = ReconciliationError.configurationError(name, cause);
            metrics.error(error);
            logger.error("[{}] Configuration error, aborting reconciliation pass: {}", name, cause.getMessage());
            return ManagerResult.aborted(name, error);
        }
        ReconciliationError error = ReconciliationError.backendFailure(name, operation, cause);
        metrics.error(error);
        logger.warn("[{}] {}", name, error.getMessage());
        logger.debug("[{}] Backend failure details", name, cause);
        return ManagerResult.failed(name, error);
    }

    public static <S> Builder<S> newBuilder() {
        return new Builder<>();
    }

    public static final class Builder<S> {

        private final List<ResourceManager<S>> managers = new ArrayList<>();
        private final List<ObjectTypeDescriptor<?>> extraDescriptors = new ArrayList<>();
        private ResourceStore store;
        private ReconcilerConfiguration configuration;
        private Scheduler managerScheduler;
        private Scheduler passScheduler;
        private ConvergenceRuntime runtime;

        private Builder() {
        }

        public Builder<S> withManager(ResourceManager<S> manager) {
            managers.add(manager);
            return this;
        }

        public Builder<S> withManagers(List<? extends ResourceManager<S>> managers) {
            this.managers.addAll(managers);
            return this;
        }

        /**
         * Registers a descriptor for an object type no manager declares. Needed only when a manager emits objects of
         * a type owned by another component.
         */
        public Builder<S> withObjectType(ObjectTypeDescriptor<?> descriptor) {
            extraDescriptors.add(descriptor);
            return this;
        }

        public Builder<S> withResourceStore(ResourceStore store) {
            this.store = store;
            return this;
        }

        public Builder<S> withConfiguration(ReconcilerConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * Scheduler running managers in parallel when the manager concurrency is above 1. Defaults to a bounded
         * elastic scheduler owned, and disposed on shutdown, by the orchestrator.
         */
        public Builder<S> withManagerScheduler(Scheduler managerScheduler) {
            this.managerScheduler = managerScheduler;
            return this;
        }

        /**
         * Scheduler the passes started with {@link DefaultReconciliationOrchestrator#reconcileAsync} run on. Must differ from the manager scheduler,
         * as a pass blocks while its managers run. Defaults to {@link Schedulers#boundedElastic()}.
         */
        public Builder<S> withPassScheduler(Scheduler passScheduler) {
            this.passScheduler = passScheduler;
            return this;
        }

        public Builder<S> withRuntime(ConvergenceRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        /**
         * @throws ReconcilerException if two managers share a name, two descriptors claim the same type, or a manager
         *                             overrides the comparator of an unregistered type
         */
        public DefaultReconciliationOrchestrator<S> build() {
            Preconditions.checkNotNull(store, "resource store not set");
            Preconditions.checkArgument(managerScheduler == null || managerScheduler != passScheduler,
                    "pass and manager schedulers must be different");
            if (configuration == null) {
                configuration = ConfigurationProxies.defaults(ReconcilerConfiguration.class);
            }
            if (runtime == null) {
                runtime = ConvergenceRuntimes.internal();
            }

            Set<String> names = new HashSet<>();
            ComparatorRegistry.Builder registryBuilder = ComparatorRegistry.newBuilder();
            for (ResourceManager<S> manager : managers) {
                if (!names.add(manager.getName())) {
                    throw ReconcilerException.duplicateManager(manager.getName());
                }
                registryBuilder.registerAll(manager.getObjectTypes());
            }
            registryBuilder.registerAll(extraDescriptors);
            ComparatorRegistry registry = registryBuilder.build();

            for (ResourceManager<S> manager : managers) {
                for (ObjectType<?> type : manager.getCustomComparators().getTypes()) {
                    registry.getDescriptor(type);
                }
            }

            List<Scheduler> ownedSchedulers = new ArrayList<>();
            if (managerScheduler == null) {
                managerScheduler = Schedulers.newBoundedElastic(
                        Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "reconciler-managers"
                );
                ownedSchedulers.add(managerScheduler);
            }
            if (passScheduler == null) {
                passScheduler = Schedulers.boundedElastic();
            }

            return new DefaultReconciliationOrchestrator<>(ImmutableList.copyOf(managers), registry, store, configuration,
                    managerScheduler, passScheduler, ownedSchedulers, runtime);
        }
    }
}
