package dao.bridge.dataworker.client;

import dao.bridge.dataworker.config.ChainProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Configuration
public class SpokePoolClientConfig {

    /**
     * One in-process client per configured spoke. Event ingestion writes into these caches.
     */
    @Bean
    public SpokePoolClients spokePoolClients(ChainProperties chainProps) {
        Map<Integer, SpokePoolClient> clients = new TreeMap<>();
        for (Integer chainId : chainProps.getSpokes().keySet()) {
            clients.put(chainId, new InMemorySpokePoolClient(chainId));
        }
        log.info("Spoke pool clients configured for chains {}", clients.keySet());
        return new SpokePoolClients(clients);
    }
}
