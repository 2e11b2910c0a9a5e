package dev.jobharvest;

import dev.jobharvest.model.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobHarvestApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobHarvestApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            RunResult result = pipelineRunner.execute();
            log.info("Job Harvest exiting...");
            exitManager.completed(result);
        } catch (Exception e) {
            log.error("Job Harvest failed: {}", e.getMessage());
            exitManager.failed(e);
        }
    }
}
