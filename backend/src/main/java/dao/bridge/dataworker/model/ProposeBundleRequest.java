package dao.bridge.dataworker.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

@Data
public class ProposeBundleRequest {

    @NotEmpty
    private Map<Integer, @Valid ChainRange> ranges;

    @Data
    public static class ChainRange {
        @NotNull
        @PositiveOrZero
        private Long startBlock;

        @NotNull
        @PositiveOrZero
        private Long endBlock;
    }

    public BundleBlockRange toBlockRange() {
        Map<Integer, BundleBlockRange.BlockRange> out = new TreeMap<>();
        ranges.forEach((chainId, r) -> out.put(chainId, new BundleBlockRange.BlockRange(r.getStartBlock(), r.getEndBlock())));
        return BundleBlockRange.of(out);
    }
}
