package com.elssolution.meterhistory;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // shutdownNow interrupts backend calls still in flight when the context closes
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService historyQueryExecutor(@Value("${history.executor.threads:4}") int threads) {
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r);
            t.setName("history-q-" + t.getId()); // unique name → easier to follow in logs
            t.setDaemon(true);
            return t;
        });
    }
}
