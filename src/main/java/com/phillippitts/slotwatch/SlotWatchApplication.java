package com.phillippitts.slotwatch;

import com.phillippitts.slotwatch.config.properties.MonitorProperties;
import com.phillippitts.slotwatch.config.properties.NotifierProperties;
import com.phillippitts.slotwatch.config.properties.ProbeProperties;
import com.phillippitts.slotwatch.config.properties.SubscriberProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        ProbeProperties.class,
        NotifierProperties.class,
        SubscriberProperties.class
})
@EnableScheduling
public class SlotWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlotWatchApplication.class, args);
    }

}
