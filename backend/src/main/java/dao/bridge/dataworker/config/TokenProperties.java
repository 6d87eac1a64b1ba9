package dao.bridge.dataworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Configuration
@ConfigurationProperties(prefix = "token")
@Data
public class TokenProperties {

    /**
     * L1 tokens pooled on the hub and their spoke-chain counterparts.
     */
    private List<L1Token> l1Tokens = new ArrayList<>();

    @Data
    public static class L1Token {
        /**
         * L1 token address (0x-prefixed)
         * Example: 0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2
         */
        private String address;

        /**
         * Minimum accumulated running balance before the hub sends funds to a spoke.
         * Below it the balance is carried to the next bundle. Default: 0 (always send)
         */
        private BigInteger transferThreshold = BigInteger.ZERO;

        /**
         * chainId -> token address on that chain
         */
        private Map<Integer, String> routes = new TreeMap<>();
    }
}
