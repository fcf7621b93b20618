package dev.compass.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Thread pools for blocking outbound work.
 *
 * <p>{@code searchExecutor} runs individual provider calls so the chain can bound each one with a
 * timeout. A timed-out HTTP call keeps its thread until the socket read timeout fires, so both
 * the thread count and the queue are capped; once full, submissions are rejected and the chain
 * treats the provider as declined. {@code retrievalExecutor} runs the local side of hybrid
 * retrieval next to the web side.
 */
@Configuration
public class ExecutorConfig {

  static final int SEARCH_THREADS = 16;
  static final int SEARCH_QUEUE_CAPACITY = 64;
  static final int RETRIEVAL_THREADS = 4;
  static final int RETRIEVAL_QUEUE_CAPACITY = 32;

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor() {
    return boundedPool("search-", SEARCH_THREADS, SEARCH_QUEUE_CAPACITY);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService retrievalExecutor() {
    return boundedPool("retrieval-", RETRIEVAL_THREADS, RETRIEVAL_QUEUE_CAPACITY);
  }

  static ThreadPoolExecutor boundedPool(String prefix, int threads, int queueCapacity) {
    CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
    factory.setDaemon(true);
    ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            threads,
            threads,
            60,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            factory,
            new ThreadPoolExecutor.AbortPolicy());
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }
}
