package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.registryapi.access.AccessPolicy;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/access")
public class AccessController {
  private final AccessPolicy accessPolicy;

  public AccessController(AccessPolicy accessPolicy) {
    this.accessPolicy = accessPolicy;
  }

  @GetMapping
  public ResponseEntity<AccessResponse> access(
      @RequestParam("address") String address,
      @RequestParam(name = "intentId", required = false) Long intentId) {
    Address subject = Address.of(address);
    Boolean canCancel = intentId == null ? null : accessPolicy.canCancel(intentId, subject);
    Boolean canExecute = intentId == null ? null : accessPolicy.canExecute(intentId);
    return ResponseEntity.ok(
        new AccessResponse(
            subject.value(),
            accessPolicy.isOwner(subject),
            accessPolicy.isController(subject),
            accessPolicy.isKeeper(subject),
            intentId,
            canCancel,
            canExecute));
  }
}
