package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.treasury.TreasuryWithdrawal;
import com.intentregistry.registryapi.registry.RegistryFacade;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/treasury")
public class TreasuryController {
  private final RegistryFacade registryFacade;

  public TreasuryController(RegistryFacade registryFacade) {
    this.registryFacade = registryFacade;
  }

  @GetMapping
  public ResponseEntity<TreasuryResponse> balance() {
    return ResponseEntity.ok(TreasuryResponse.from(registryFacade.treasuryBalance()));
  }

  @PostMapping("/deposits")
  public ResponseEntity<TreasuryResponse> deposit(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody TreasuryDepositRequest request) {
    return ResponseEntity.ok(
        TreasuryResponse.from(registryFacade.deposit(RequestValues.caller(jwt), request.amount())));
  }

  @PostMapping("/withdrawals")
  public ResponseEntity<TreasuryWithdrawalResponse> withdraw(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody TreasuryWithdrawalRequest request) {
    TreasuryWithdrawal withdrawal =
        registryFacade.withdraw(
            RequestValues.caller(jwt), Address.of(request.to()), request.amount());
    return ResponseEntity.ok(TreasuryWithdrawalResponse.from(withdrawal));
  }
}
