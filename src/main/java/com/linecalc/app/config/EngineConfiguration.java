package com.linecalc.app.config;

import com.linecalc.app.engine.ResultFormatter;
import com.linecalc.app.evaluators.ArithmeticEvaluator;
import com.linecalc.app.evaluators.BaseConversionEvaluator;
import com.linecalc.app.evaluators.DateTimeEvaluator;
import com.linecalc.app.evaluators.DomainEvaluator;
import com.linecalc.app.evaluators.NetworkEvaluator;
import com.linecalc.app.evaluators.PercentagePhraseEvaluator;
import com.linecalc.app.services.DocumentService;
import com.linecalc.app.services.DomainDispatcher;
import com.linecalc.app.services.LineOrchestrator;
import com.linecalc.app.services.ReferenceAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Wires the calculation engine. The evaluator order here is the dispatch
 * priority: network, date/time, percentage phrasing, base conversion,
 * and arithmetic last.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public ZoneId calculatorZone(CalculatorProperties properties) {
        String zone = properties.getTimeZone();
        ZoneId id = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("Using time zone {}", id);
        return id;
    }

    @Bean
    public Clock calculatorClock(ZoneId calculatorZone) {
        return Clock.system(calculatorZone);
    }

    @Bean
    public ResultFormatter resultFormatter(CalculatorProperties properties) {
        return new ResultFormatter(properties.getFormat().getPlainFractionDigits());
    }

    @Bean
    public DomainDispatcher domainDispatcher(Clock clock, ZoneId zone, ResultFormatter formatter) {
        return new DomainDispatcher(defaultEvaluators(clock, zone, formatter));
    }

    @Bean
    public LineOrchestrator lineOrchestrator(DomainDispatcher dispatcher) {
        return new LineOrchestrator(dispatcher);
    }

    @Bean
    public ReferenceAdjuster referenceAdjuster() {
        return new ReferenceAdjuster();
    }

    @Bean
    public DocumentService documentService(LineOrchestrator orchestrator, ReferenceAdjuster adjuster,
                                           ResultFormatter formatter, CalculatorProperties properties) {
        return new DocumentService(orchestrator, adjuster, formatter, properties.getMaxLines());
    }

    /**
     * The evaluators in dispatch order. Also used to build the engine outside Spring.
     */
    public static List<DomainEvaluator> defaultEvaluators(Clock clock, ZoneId zone, ResultFormatter formatter) {
        return List.of(
                new NetworkEvaluator(),
                new DateTimeEvaluator(clock, zone),
                new PercentagePhraseEvaluator(formatter),
                new BaseConversionEvaluator(),
                new ArithmeticEvaluator(formatter)
        );
    }
}
