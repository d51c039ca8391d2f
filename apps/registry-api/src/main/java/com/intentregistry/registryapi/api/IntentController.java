package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.registryapi.intents.IntentQueryService;
import com.intentregistry.registryapi.intents.SubmitIntentCommand;
import com.intentregistry.registryapi.registry.RegistryFacade;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/intents")
public class IntentController {
  private final RegistryFacade registryFacade;
  private final IntentQueryService intentQueryService;

  public IntentController(RegistryFacade registryFacade, IntentQueryService intentQueryService) {
    this.registryFacade = registryFacade;
    this.intentQueryService = intentQueryService;
  }

  @PostMapping
  public ResponseEntity<IntentResponse> submit(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody SubmitIntentRequest request) {
    Intent intent =
        registryFacade.submit(RequestValues.caller(jwt), request.toCommand(), request.fee());
    return ResponseEntity.status(HttpStatus.CREATED).body(IntentResponse.from(intent));
  }

  @PostMapping("/batch")
  public ResponseEntity<List<IntentResponse>> submitBatch(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody SubmitBatchRequest request) {
    List<SubmitIntentCommand> commands =
        request.intents().stream().map(IntentEntryRequest::toCommand).toList();
    List<Intent> intents =
        registryFacade.submitBatch(RequestValues.caller(jwt), commands, request.totalFee());
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponses(intents));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<IntentResponse> cancel(
      @AuthenticationPrincipal Jwt jwt, @PathVariable("id") long id) {
    Intent cancelled = registryFacade.cancel(RequestValues.caller(jwt), id);
    return ResponseEntity.ok(IntentResponse.from(cancelled));
  }

  @GetMapping("/{id}")
  public ResponseEntity<IntentResponse> get(@PathVariable("id") long id) {
    return ResponseEntity.ok(IntentResponse.from(intentQueryService.get(id)));
  }

  /** Exactly one of {@code submitter} or {@code symbol} must be given. */
  @GetMapping
  public ResponseEntity<List<IntentResponse>> list(
      @RequestParam(name = "submitter", required = false) String submitter,
      @RequestParam(name = "symbol", required = false) String symbol) {
    boolean bySubmitter = submitter != null && !submitter.isBlank();
    boolean bySymbol = symbol != null && !symbol.isBlank();
    if (bySubmitter == bySymbol) {
      throw new IllegalArgumentException("Specify exactly one of 'submitter' or 'symbol'");
    }
    List<Intent> intents =
        bySubmitter
            ? intentQueryService.bySubmitter(Address.of(submitter))
            : intentQueryService.bySymbol(RequestValues.symbol(symbol));
    return ResponseEntity.ok(toResponses(intents));
  }

  @GetMapping("/index/{index}")
  public ResponseEntity<IntentResponse> atIndex(@PathVariable("index") long index) {
    return ResponseEntity.ok(IntentResponse.from(intentQueryService.atIndex(index)));
  }

  @GetMapping("/range")
  public ResponseEntity<List<IntentResponse>> range(
      @RequestParam("from") long from, @RequestParam("to") long to) {
    return ResponseEntity.ok(toResponses(intentQueryService.range(from, to)));
  }

  @GetMapping("/latest")
  public ResponseEntity<List<IntentResponse>> latest(
      @RequestParam(name = "count", defaultValue = "10") long count) {
    return ResponseEntity.ok(toResponses(intentQueryService.latest(count)));
  }

  @GetMapping("/by-sequence")
  public ResponseEntity<List<IntentResponse>> bySequence(
      @RequestParam("fromSeq") long fromSeq, @RequestParam("toSeq") long toSeq) {
    return ResponseEntity.ok(toResponses(intentQueryService.bySequence(fromSeq, toSeq)));
  }

  @PostMapping("/bulk")
  public ResponseEntity<List<IntentResponse>> bulk(@Valid @RequestBody BulkQueryRequest request) {
    return ResponseEntity.ok(toResponses(intentQueryService.bulk(request.ids())));
  }

  private static List<IntentResponse> toResponses(List<Intent> intents) {
    return intents.stream().map(IntentResponse::from).toList();
  }
}
