package com.phillippitts.voicegraph;

import com.phillippitts.voicegraph.config.properties.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class
})
public class VoiceGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceGraphApplication.class, args);
    }

}
