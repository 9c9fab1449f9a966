package com.scifund.api.platform;

import com.scifund.api.access.Principals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Platform administration REST API.
 */
@RestController
@RequestMapping("/api/v1/platform")
public class PlatformController {

    private final PlatformService platformService;

    public PlatformController(PlatformService platformService) {
        this.platformService = platformService;
    }

    @GetMapping("/settings")
    public ResponseEntity<PlatformService.SettingsView> getSettings() {
        return ResponseEntity.ok(platformService.getPlatformSettings());
    }

    /**
     * PUT /api/v1/platform/verifiers/{principalId}
     */
    @PutMapping("/verifiers/{principalId}")
    public ResponseEntity<VerifierStatus> setVerifier(
            @RequestHeader(Principals.HEADER) String caller,
            @PathVariable String principalId,
            @Valid @RequestBody VerifierRequest request) {
        platformService.setVerifier(caller, principalId, request.enabled());
        return ResponseEntity.ok(new VerifierStatus(principalId, platformService.isVerifier(principalId)));
    }

    @GetMapping("/verifiers/{principalId}")
    public ResponseEntity<VerifierStatus> getVerifier(@PathVariable String principalId) {
        return ResponseEntity.ok(new VerifierStatus(principalId, platformService.isVerifier(principalId)));
    }

    /**
     * PUT /api/v1/platform/fee
     */
    @PutMapping("/fee")
    public ResponseEntity<PlatformService.SettingsView> setPlatformFee(
            @RequestHeader(Principals.HEADER) String caller,
            @Valid @RequestBody FeeRequest request) {
        platformService.setPlatformFee(caller, request.feeBps());
        return ResponseEntity.ok(platformService.getPlatformSettings());
    }

    @PutMapping("/fee-recipient")
    public ResponseEntity<PlatformService.SettingsView> setFeeRecipient(
            @RequestHeader(Principals.HEADER) String caller,
            @Valid @RequestBody FeeRecipientRequest request) {
        platformService.setFeeRecipient(caller, request.recipient());
        return ResponseEntity.ok(platformService.getPlatformSettings());
    }

    /**
     * POST /api/v1/platform/emergency-withdraw
     */
    @PostMapping("/emergency-withdraw")
    public ResponseEntity<WithdrawalResponse> emergencyWithdraw(@RequestHeader(Principals.HEADER) String caller) {
        return ResponseEntity.ok(new WithdrawalResponse(platformService.emergencyWithdraw(caller)));
    }

    @GetMapping("/accounts/{accountKey}")
    public ResponseEntity<PlatformService.AccountView> getAccount(@PathVariable String accountKey) {
        return ResponseEntity.ok(platformService.getAccountBalance(accountKey));
    }

    @GetMapping("/pool")
    public ResponseEntity<PoolResponse> getPool() {
        return ResponseEntity.ok(new PoolResponse(platformService.getPoolBalance()));
    }

    // DTOs
    public record VerifierRequest(@NotNull Boolean enabled) {}

    public record FeeRequest(@NotNull Integer feeBps) {}

    public record FeeRecipientRequest(String recipient) {}

    public record VerifierStatus(String principalId, boolean trusted) {}

    public record WithdrawalResponse(BigInteger amount) {}

    public record PoolResponse(BigInteger balance) {}
}
