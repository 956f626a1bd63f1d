package com.example.curator.rag;

import com.example.curator.rag.config.AiProviderProperties;
import com.example.curator.rag.config.RagProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AiProviderProperties.class, RagProperties.class})
public class CuratorRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CuratorRagApplication.class, args);
    }

}
