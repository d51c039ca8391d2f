package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.ExecutionRecord;
import com.intentregistry.registryapi.executions.ExecutionQueryService;
import com.intentregistry.registryapi.executions.ExecutionStatistics;
import com.intentregistry.registryapi.executions.ExecutionStatisticsService;
import com.intentregistry.registryapi.executions.VolumeSummary;
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
@RequestMapping("/v1/executions")
public class ExecutionController {
  private final RegistryFacade registryFacade;
  private final ExecutionQueryService executionQueryService;
  private final ExecutionStatisticsService executionStatisticsService;

  public ExecutionController(
      RegistryFacade registryFacade,
      ExecutionQueryService executionQueryService,
      ExecutionStatisticsService executionStatisticsService) {
    this.registryFacade = registryFacade;
    this.executionQueryService = executionQueryService;
    this.executionStatisticsService = executionStatisticsService;
  }

  @PostMapping
  public ResponseEntity<ExecutionResponse> execute(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody ExecuteIntentRequest request) {
    ExecutionRecord record =
        registryFacade.execute(
            RequestValues.caller(jwt),
            request.intentId(),
            request.executedAmount(),
            request.avgPrice());
    return ResponseEntity.status(HttpStatus.CREATED).body(ExecutionResponse.from(record));
  }

  @GetMapping("/{intentId}")
  public ResponseEntity<ExecutionResponse> get(@PathVariable("intentId") long intentId) {
    return ResponseEntity.ok(ExecutionResponse.from(executionQueryService.get(intentId)));
  }

  @GetMapping("/latest")
  public ResponseEntity<List<ExecutionResponse>> latest(
      @RequestParam(name = "count", defaultValue = "10") long count) {
    return ResponseEntity.ok(toResponses(executionQueryService.latest(count)));
  }

  @GetMapping("/range")
  public ResponseEntity<List<ExecutionResponse>> range(
      @RequestParam("from") long from, @RequestParam("to") long to) {
    return ResponseEntity.ok(toResponses(executionQueryService.range(from, to)));
  }

  @PostMapping("/bulk")
  public ResponseEntity<List<ExecutionResponse>> bulk(
      @Valid @RequestBody BulkQueryRequest request) {
    return ResponseEntity.ok(toResponses(executionQueryService.bulk(request.ids())));
  }

  @GetMapping("/stats")
  public ResponseEntity<ExecutionStatistics> statistics() {
    return ResponseEntity.ok(executionStatisticsService.statistics());
  }

  @GetMapping("/stats/symbols/{symbol}")
  public ResponseEntity<VolumeSummary> volumeBySymbol(@PathVariable("symbol") String symbol) {
    return ResponseEntity.ok(
        executionStatisticsService.volumeBySymbol(RequestValues.symbol(symbol)));
  }

  @GetMapping("/stats/submitters/{address}")
  public ResponseEntity<VolumeSummary> volumeBySubmitter(@PathVariable("address") String address) {
    return ResponseEntity.ok(executionStatisticsService.volumeBySubmitter(Address.of(address)));
  }

  private static List<ExecutionResponse> toResponses(List<ExecutionRecord> records) {
    return records.stream().map(ExecutionResponse::from).toList();
  }
}
