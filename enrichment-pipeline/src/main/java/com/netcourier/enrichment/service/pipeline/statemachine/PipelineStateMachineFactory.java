package com.netcourier.enrichment.service.pipeline.statemachine;

import com.netcourier.enrichment.model.PipelineState;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;

@Component
public class PipelineStateMachineFactory {

    static final List<PipelineState> FORWARD = List.of(
            PipelineState.INGESTED,
            PipelineState.LANGUAGE_DETECTED,
            PipelineState.STRUCTURED,
            PipelineState.ANNOTATED,
            PipelineState.CHUNKED,
            PipelineState.ENRICHING,
            PipelineState.EMBEDDED,
            PipelineState.STORED);

    static final List<PipelineState> FAILABLE = List.of(
            PipelineState.INGESTED,
            PipelineState.LANGUAGE_DETECTED,
            PipelineState.STRUCTURED,
            PipelineState.ANNOTATED);

    public StateMachine<PipelineState, PipelineEvent> create(String runId) {
        try {
            StateMachineBuilder.Builder<PipelineState, PipelineEvent> builder = StateMachineBuilder.builder();
            builder.configureConfiguration()
                    .withConfiguration()
                    .machineId(runId)
                    .autoStartup(false);
            builder.configureStates()
                    .withStates()
                    .initial(PipelineState.INGESTED)
                    .states(EnumSet.allOf(PipelineState.class))
                    .end(PipelineState.STORED)
                    .end(PipelineState.FAILED);
            StateMachineTransitionConfigurer<PipelineState, PipelineEvent> transitions = builder.configureTransitions();
            for (int i = 0; i < FORWARD.size() - 1; i++) {
                transitions.withExternal()
                        .source(FORWARD.get(i))
                        .target(FORWARD.get(i + 1))
                        .event(PipelineEvent.ADVANCE);
            }
            for (PipelineState source : FAILABLE) {
                transitions.withExternal()
                        .source(source)
                        .target(PipelineState.FAILED)
                        .event(PipelineEvent.FAIL);
            }
            StateMachine<PipelineState, PipelineEvent> machine = builder.build();
            machine.startReactively().block();
            return machine;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build state machine for run " + runId, e);
        }
    }

    public static boolean send(StateMachine<PipelineState, PipelineEvent> machine, PipelineEvent event) {
        StateMachineEventResult<PipelineState, PipelineEvent> result = machine
                .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                .blockLast();
        return result != null && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
    }
}
