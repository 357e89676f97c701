package com.eainde.atc.thread;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared pool for analysis jobs, agent fan-out and timed model calls.
 *
 * <p>The pool is unbounded. Model calls are capped separately by
 * {@link com.eainde.atc.llm.ModelCallGate}.</p>
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("atc-analysis-");
        threadFactory.setDaemon(true);
        return new MdcAwareExecutorService(Executors.newCachedThreadPool(threadFactory));
    }
}
