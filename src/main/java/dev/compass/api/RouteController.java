package dev.compass.api;

import dev.compass.retrieval.LocalRetriever;
import dev.compass.router.RouterStats;
import dev.compass.router.RoutingHistoryEntry;
import dev.compass.router.RoutingResult;
import dev.compass.router.SourceRouter;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the router. Routing failures are reported inside the returned outcome, so every
 * well-formed request gets a 200; only invalid bodies are rejected.
 */
@RestController
@RequestMapping("/api/route")
public class RouteController {

  private final SourceRouter router;
  private final ObjectProvider<LocalRetriever> localRetriever;

  public RouteController(SourceRouter router, ObjectProvider<LocalRetriever> localRetriever) {
    this.router = router;
    this.localRetriever = localRetriever;
  }

  @PostMapping
  public RoutingResult route(@Valid @RequestBody RouteRequest request) {
    return router.route(
        request.query(), localRetriever.getIfAvailable(), request.hasLocalDocuments());
  }

  @GetMapping("/stats")
  public RouterStats stats() {
    return router.getStats();
  }

  @GetMapping("/history")
  public List<RoutingHistoryEntry> history() {
    return router.history();
  }
}
