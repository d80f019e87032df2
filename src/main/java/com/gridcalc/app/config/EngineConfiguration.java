package com.gridcalc.app.config;

import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.FormulaParser;
import com.gridcalc.app.formula.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the stateless formula engine pieces and the clock shared by
 * date functions, timestamps and heartbeat expiry.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FunctionRegistry functionRegistry() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();
        log.info("Registered {} formula functions", registry.names().size());
        return registry;
    }

    @Bean
    public FormulaParser formulaParser(FunctionRegistry functionRegistry) {
        return new FormulaParser(functionRegistry);
    }

    @Bean
    public FormulaEvaluator formulaEvaluator() {
        return new FormulaEvaluator();
    }
}
