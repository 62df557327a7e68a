package com.moneylens.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        SchedulerConfig.class
})
class CacheAndSchedulerConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("embedding cache is created and usable")
    void embeddingCacheUsable() {
        Cache cache = cacheManager.getCache(CaffeineConfig.EMBEDDING_CACHE);
        assertThat(cache).isNotNull();

        cache.put("gas station", new double[]{0.1, 0.2});
        assertThat((double[]) cache.get("gas station").get()).containsExactly(0.1, 0.2);
    }

    @Test
    @DisplayName("scheduler pool is single-threaded")
    void schedulerPoolCreated() {
        assertThat(schedulerPool).isNotNull();
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(1);
    }
}
