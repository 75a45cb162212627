package dao.tron.rdist.controller;

import dao.tron.rdist.model.AvailableClaim;
import dao.tron.rdist.model.ClaimProof;
import dao.tron.rdist.model.ClaimRecord;
import dao.tron.rdist.model.ClaimTransaction;
import dao.tron.rdist.service.ClaimService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/claims")
public class ClaimController {

    private final ClaimService claimService;

    public ClaimController(ClaimService claimService) {
        this.claimService = claimService;
    }

    @GetMapping("/{identity}")
    public ResponseEntity<List<AvailableClaim>> available(@PathVariable String identity) {
        return ResponseEntity.ok(claimService.getAvailableClaims(identity));
    }

    @GetMapping("/{identity}/records")
    public ResponseEntity<List<ClaimRecord>> records(@PathVariable String identity) {
        return ResponseEntity.ok(claimService.getClaimRecords(identity));
    }

    @GetMapping("/{channel}/{epoch}/{identity}/proof")
    public ResponseEntity<ClaimProof> proof(@PathVariable String channel,
                                            @PathVariable long epoch,
                                            @PathVariable String identity) {
        return ResponseEntity.ok(claimService.getProof(epoch, channel, identity));
    }

    @PostMapping("/{channel}/{epoch}/{identity}/transaction")
    public ResponseEntity<ClaimTransaction> transaction(@PathVariable String channel,
                                                        @PathVariable long epoch,
                                                        @PathVariable String identity,
                                                        @RequestParam String claimer) {
        return ResponseEntity.ok(claimService.submitClaimTransaction(epoch, channel, identity, claimer));
    }

    @PostMapping("/{channel}/{epoch}/{identity}/confirm")
    public ResponseEntity<ClaimRecord> confirm(@PathVariable String channel,
                                               @PathVariable long epoch,
                                               @PathVariable String identity,
                                               @RequestParam(required = false) String txRef) {
        return ResponseEntity.ok(claimService.confirmClaim(identity, epoch, channel, txRef));
    }

    @PostMapping("/{channel}/{epoch}/{identity}/fail")
    public ResponseEntity<ClaimRecord> fail(@PathVariable String channel,
                                            @PathVariable long epoch,
                                            @PathVariable String identity,
                                            @RequestParam(required = false) String txRef) {
        return ResponseEntity.ok(claimService.failClaim(identity, epoch, channel, txRef));
    }
}
