package com.goalguard.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goalguard.core.audit.AuditSink;
import com.goalguard.core.audit.JsonLogAuditSink;
import com.goalguard.core.events.EventBus;
import com.goalguard.core.fsm.GoalGuardStateMachine;
import com.goalguard.core.fsm.TransitionTable;
import com.goalguard.core.gate.DevGate;
import com.goalguard.core.gate.GateSettings;
import com.goalguard.core.gate.ProductGate;
import com.goalguard.core.metrics.GoalGuardMetrics;
import com.goalguard.core.reflexion.ReflexionEngine;
import com.goalguard.core.scorecard.PromotionScorecard;
import com.goalguard.core.strict.StrictMode;
import com.goalguard.core.tools.CommandToolInvoker;
import com.goalguard.core.tools.TimeBoundToolInvoker;
import com.goalguard.core.tools.ToolCallRecorder;
import com.goalguard.core.tools.ToolInvoker;
import com.goalguard.core.walkforward.WalkForwardValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the goal-guard core from {@link GoalGuardProperties}. Settings are read once at
 * startup and handed to each component as immutable records.
 */
@Configuration
public class GoalGuardConfig {

    @Bean
    public WalkForwardValidator walkForwardValidator(GoalGuardProperties properties) {
        return new WalkForwardValidator(properties.toWalkForwardConfig());
    }

    @Bean
    public GateSettings gateSettings(GoalGuardProperties properties) {
        return properties.toGateSettings();
    }

    @Bean
    public DevGate devGate(GateSettings gateSettings) {
        return new DevGate(gateSettings);
    }

    @Bean
    public ProductGate productGate(GateSettings gateSettings, WalkForwardValidator validator) {
        return new ProductGate(gateSettings, validator);
    }

    @Bean
    public ReflexionEngine reflexionEngine(GoalGuardProperties properties) {
        return new ReflexionEngine(properties.toReflexionSettings());
    }

    @Bean
    public PromotionScorecard promotionScorecard(GoalGuardProperties properties) {
        PromotionScorecard scorecard = new PromotionScorecard(properties.toScorecardSettings());
        return properties.toWeightProfile().map(scorecard::withProfile).orElse(scorecard);
    }

    @Bean
    public TransitionTable transitionTable() {
        return TransitionTable.standard();
    }

    /**
     * External tools run as configured commands, each call bounded by
     * {@code goalguard.tools.timeout-seconds}.
     */
    @Bean
    @ConditionalOnMissingBean(ToolInvoker.class)
    public ToolInvoker toolInvoker(GoalGuardProperties properties, ObjectMapper objectMapper) {
        return new TimeBoundToolInvoker(new CommandToolInvoker(properties.toolCommands(), objectMapper),
                properties.toolTimeout());
    }

    @Bean
    public ToolCallRecorder toolCallRecorder(GoalGuardMetrics metrics, EventBus eventBus) {
        return new ToolCallRecorder(metrics, eventBus);
    }

    @Bean
    @ConditionalOnMissingBean(AuditSink.class)
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new JsonLogAuditSink(objectMapper);
    }

    @Bean
    public StrictMode strictMode(GoalGuardProperties properties) {
        return new StrictMode(properties.isStrictMode());
    }

    @Bean
    public GoalGuardStateMachine goalGuardStateMachine(TransitionTable table,
                                                       ToolInvoker toolInvoker,
                                                       ToolCallRecorder recorder,
                                                       DevGate devGate,
                                                       ProductGate productGate,
                                                       ReflexionEngine reflexionEngine,
                                                       PromotionScorecard scorecard,
                                                       GateSettings gateSettings,
                                                       AuditSink auditSink,
                                                       EventBus eventBus,
                                                       GoalGuardMetrics metrics) {
        return new GoalGuardStateMachine(table, toolInvoker, recorder, devGate, productGate, reflexionEngine,
                scorecard, gateSettings, auditSink, eventBus, metrics);
    }
}
