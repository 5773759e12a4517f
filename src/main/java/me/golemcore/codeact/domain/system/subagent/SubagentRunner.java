/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.codeact.domain.system.subagent;

import me.golemcore.codeact.domain.agent.AgentInstance;
import me.golemcore.codeact.domain.agent.AgentInstanceFactory;
import me.golemcore.codeact.domain.model.AgentEvent;
import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.service.ToolResultMaterializer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs delegated tasks on freshly spawned child agent instances.
 *
 * <p>
 * Each delegation waits for an admission slot, spawns a child with its own
 * resources and a new {@code sub-xxxx} id, relays every child event unchanged,
 * and ends with one {@link AgentEvent.ToolOutput} under the parent's id and the
 * delegation's corrId. Its content is the child's last response, or
 * {@code "Subagent error: ..."} if the child failed. The child is stopped and
 * its slot released on completion, failure and cancellation.
 */
@Slf4j
public class SubagentRunner {

    public static final String ERROR_PREFIX = "Subagent error: ";

    private final String parentAgentId;
    private final AgentSettings parentSettings;
    private final String sessionId;
    private final AgentInstanceFactory instanceFactory;
    private final ToolResultMaterializer materializer;
    private final AdmissionLimiter admission;
    private final Set<AgentInstance> live = ConcurrentHashMap.newKeySet();

    public SubagentRunner(String parentAgentId, AgentSettings parentSettings, String sessionId,
            AgentInstanceFactory instanceFactory, ToolResultMaterializer materializer) {
        this.parentAgentId = parentAgentId;
        this.parentSettings = parentSettings;
        this.sessionId = sessionId;
        this.instanceFactory = instanceFactory;
        this.materializer = materializer;
        this.admission = new AdmissionLimiter(parentAgentId + "-subagents", parentSettings.getMaxSubagents());
    }

    /**
     * Delegates {@code prompt} to a new child bounded by {@code maxTurns} rounds.
     */
    public Flux<AgentEvent> run(String prompt, int maxTurns, String corrId) {
        AtomicReference<String> lastResponse = new AtomicReference<>("");
        Flux<AgentEvent> childEvents = Flux.usingWhen(
                admission.acquire(),
                permit -> Flux.usingWhen(
                        Mono.fromCallable(this::spawn).subscribeOn(Schedulers.boundedElastic()),
                        child -> child.stream(prompt, maxTurns)
                                .doOnNext(event -> {
                                    if (event instanceof AgentEvent.Response response
                                            && child.getAgentId().equals(response.agentId())) {
                                        lastResponse.set(response.content());
                                    }
                                }),
                        this::teardown),
                permit -> Mono.fromRunnable(permit::release));

        return childEvents
                .concatWith(Mono.fromCallable(() -> new AgentEvent.ToolOutput(parentAgentId, corrId,
                        materializer.materialize(lastResponse.get()).content())))
                .onErrorResume(e -> {
                    log.warn("[Subagent] {} delegation [{}] failed: {}", parentAgentId, corrId, e.getMessage());
                    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    return Flux.just(new AgentEvent.ToolOutput(parentAgentId, corrId, ERROR_PREFIX + message));
                });
    }

    /**
     * Hard-cancels every live child.
     */
    public void cancelAll() {
        List<AgentInstance> children = List.copyOf(live);
        for (AgentInstance child : children) {
            child.cancel();
        }
        if (!children.isEmpty()) {
            log.info("[Subagent] {} cancelled {} live subagent(s)", parentAgentId, children.size());
        }
    }

    public int activeCount() {
        return live.size();
    }

    AdmissionLimiter admission() {
        return admission;
    }

    private AgentInstance spawn() {
        AgentInstance child = instanceFactory.createSubagent(parentSettings, sessionId);
        live.add(child);
        try {
            child.start();
        } catch (RuntimeException e) {
            live.remove(child);
            throw e;
        }
        log.info("[Subagent] {} spawned {} ({} active)", parentAgentId, child.getAgentId(), live.size());
        return child;
    }

    private Mono<Void> teardown(AgentInstance child) {
        return Mono.<Void>fromRunnable(() -> {
            live.remove(child);
            child.stop();
            log.info("[Subagent] {} stopped {}", parentAgentId, child.getAgentId());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
