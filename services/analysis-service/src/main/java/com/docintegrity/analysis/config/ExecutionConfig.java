package com.docintegrity.analysis.config;

import com.docintegrity.analysis.service.support.MdcPropagatingExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService pipelineExecutor() {
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool(daemonThreads("analysis-pipeline-")));
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService providerExecutor() {
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool(daemonThreads("provider-call-")));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
