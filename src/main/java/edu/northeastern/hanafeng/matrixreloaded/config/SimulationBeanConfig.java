package edu.northeastern.hanafeng.matrixreloaded.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientFactory;
import edu.northeastern.hanafeng.matrixreloaded.client.loopback.LoopbackChatClientFactory;
import edu.northeastern.hanafeng.matrixreloaded.client.loopback.LoopbackHomeserver;
import edu.northeastern.hanafeng.matrixreloaded.support.HomeserverAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Slf4j
@Configuration
public class SimulationBeanConfig {

    /**
     * ObjectMapper for JSON serialization/deserialization
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * ObjectMapper writing step reports as YAML
     */
    @Bean
    public ObjectMapper yamlObjectMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public LoopbackHomeserver loopbackHomeserver(SimulationConfig simulationConfig) {
        HomeserverAddress address = HomeserverAddress.parse(simulationConfig.getHomeserverUrl());
        SimulationConfig.Loopback loopback = simulationConfig.getLoopback();
        log.info("Using in-process homeserver for {}: latency={}ms, failureRate={}",
                address.serverName(), loopback.getLatency().toMillis(), loopback.getFailureRate());
        return new LoopbackHomeserver(address.serverName(), loopback.getLatency(), loopback.getFailureRate());
    }

    @Bean
    public ChatClientFactory chatClientFactory(LoopbackHomeserver loopbackHomeserver) {
        return new LoopbackChatClientFactory(loopbackHomeserver);
    }
}
