package com.phillippitts.speaktorobot;

import com.phillippitts.speaktorobot.config.properties.CommandSchemaProperties;
import com.phillippitts.speaktorobot.config.properties.ExtractionProperties;
import com.phillippitts.speaktorobot.config.properties.LanguageModelProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ExtractionProperties.class,
        CommandSchemaProperties.class,
        LanguageModelProperties.class
})
public class SpeakToRobotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakToRobotApplication.class, args);
    }

}
