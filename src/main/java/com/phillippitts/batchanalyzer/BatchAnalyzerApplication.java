package com.phillippitts.batchanalyzer;

import com.phillippitts.batchanalyzer.config.properties.CheckpointProperties;
import com.phillippitts.batchanalyzer.config.properties.CoordinatorProperties;
import com.phillippitts.batchanalyzer.config.properties.GroupingProperties;
import com.phillippitts.batchanalyzer.config.properties.ThreadPoolProperties;
import com.phillippitts.batchanalyzer.config.properties.TierProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        CoordinatorProperties.class,
        GroupingProperties.class,
        TierProperties.class,
        CheckpointProperties.class
})
@EnableScheduling
public class BatchAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchAnalyzerApplication.class, args);
    }

}
