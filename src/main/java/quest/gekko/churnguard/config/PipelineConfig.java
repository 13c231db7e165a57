package quest.gekko.churnguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executor;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock pipelineClock(final ChurnGuardProperties.Pipeline pipeline) {
        return Clock.system(ZoneId.of(pipeline.zone()));
    }

    // one thread per metric job
    @Bean(name = "extractionExecutor")
    public Executor extractionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("extract-");
        executor.initialize();
        return executor;
    }
}
