package dao.bridge.dataworker.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ValidateRootsRequest {

    @NotNull
    @Valid
    private ProposeBundleRequest range;

    @NotBlank
    private String poolRebalanceRoot;   // 0x-prefixed bytes32

    @NotBlank
    private String relayerRefundRoot;

    @NotBlank
    private String slowRelayRoot;
}
