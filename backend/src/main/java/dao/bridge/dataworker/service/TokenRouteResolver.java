package dao.bridge.dataworker.service;

import dao.bridge.dataworker.config.TokenProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps spoke-chain token addresses to the L1 token pooled on the hub and back.
 * Addresses are matched case-insensitively; L1 tokens are returned lower-case.
 */
@Slf4j
@Service
public class TokenRouteResolver {

    private record RouteKey(int chainId, String token) {}

    private final Map<RouteKey, String> l1ByL2 = new HashMap<>();
    private final Map<RouteKey, String> l2ByL1 = new HashMap<>();
    private final Map<String, BigInteger> thresholds = new HashMap<>();

    public TokenRouteResolver(TokenProperties tokenProps) {
        for (TokenProperties.L1Token t : tokenProps.getL1Tokens()) {
            String l1 = normalize(t.getAddress());
            thresholds.put(l1, t.getTransferThreshold() == null ? BigInteger.ZERO : t.getTransferThreshold());
            t.getRoutes().forEach((chainId, l2) -> {
                String prev = l1ByL2.put(new RouteKey(chainId, normalize(l2)), l1);
                if (prev != null && !prev.equals(l1)) {
                    throw new IllegalStateException("Token " + l2 + " on chain " + chainId
                            + " routed to two L1 tokens: " + prev + ", " + l1);
                }
                l2ByL1.put(new RouteKey(chainId, l1), l2);
            });
        }
        log.info("Token routes loaded: l1Tokens={}, routes={}", thresholds.size(), l1ByL2.size());
    }

    /**
     * @throws IllegalStateException when the token has no configured route
     */
    public String l1TokenFor(int chainId, String l2Token) {
        String l1 = l1ByL2.get(new RouteKey(chainId, normalize(l2Token)));
        if (l1 == null) {
            throw new IllegalStateException("No L1 token route for " + l2Token + " on chain " + chainId);
        }
        return l1;
    }

    /**
     * @throws IllegalStateException when the L1 token has no counterpart on the chain
     */
    public String l2TokenFor(String l1Token, int chainId) {
        String l2 = l2ByL1.get(new RouteKey(chainId, normalize(l1Token)));
        if (l2 == null) {
            throw new IllegalStateException("No route for L1 token " + l1Token + " to chain " + chainId);
        }
        return l2;
    }

    public BigInteger transferThreshold(String l1Token) {
        return thresholds.getOrDefault(normalize(l1Token), BigInteger.ZERO);
    }

    private static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Token address is required");
        }
        return address.toLowerCase(Locale.ROOT);
    }
}
