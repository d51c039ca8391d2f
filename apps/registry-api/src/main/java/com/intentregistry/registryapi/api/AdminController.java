package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.registryapi.registry.RegistryFacade;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Owner-only configuration. Non-owners are rejected by the registry with NOT_OWNER. */
@RestController
@RequestMapping("/v1/admin")
public class AdminController {
  private final RegistryFacade registryFacade;

  public AdminController(RegistryFacade registryFacade) {
    this.registryFacade = registryFacade;
  }

  @GetMapping("/config")
  public ResponseEntity<SettingsResponse> config() {
    return ResponseEntity.ok(SettingsResponse.from(registryFacade.settings()));
  }

  @PutMapping("/controller")
  public ResponseEntity<SettingsResponse> setController(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody AddressRequest request) {
    return ResponseEntity.ok(
        SettingsResponse.from(
            registryFacade.setController(
                RequestValues.caller(jwt), Address.of(request.address()))));
  }

  @PutMapping("/keeper")
  public ResponseEntity<SettingsResponse> setKeeper(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody AddressRequest request) {
    return ResponseEntity.ok(
        SettingsResponse.from(
            registryFacade.setKeeper(RequestValues.caller(jwt), Address.of(request.address()))));
  }

  @PutMapping("/bounds")
  public ResponseEntity<SettingsResponse> setBounds(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody BoundsRequest request) {
    return ResponseEntity.ok(
        SettingsResponse.from(
            registryFacade.setBounds(
                RequestValues.caller(jwt), request.minAmount(), request.maxAmount())));
  }

  @PutMapping("/fee")
  public ResponseEntity<SettingsResponse> setFee(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody FeeRequest request) {
    return ResponseEntity.ok(
        SettingsResponse.from(registryFacade.setFeeBps(RequestValues.caller(jwt), request.feeBps())));
  }

  @PutMapping("/pause")
  public ResponseEntity<SettingsResponse> pause(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        SettingsResponse.from(registryFacade.setPaused(RequestValues.caller(jwt), true)));
  }

  @PutMapping("/unpause")
  public ResponseEntity<SettingsResponse> unpause(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        SettingsResponse.from(registryFacade.setPaused(RequestValues.caller(jwt), false)));
  }
}
