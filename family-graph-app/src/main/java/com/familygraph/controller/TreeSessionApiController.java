package com.familygraph.controller;

import com.familygraph.model.Card;
import com.familygraph.model.NodeSummary;
import com.familygraph.service.TreeSession;
import com.familygraph.service.TreeSessionService;
import com.familygraph.service.TreeTextCodec.TreeFormatException;
import com.familygraph.store.TreeEditException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@RestController
@RequestMapping("/api/sessions")
public class TreeSessionApiController {

    private static final Logger log = LoggerFactory.getLogger(TreeSessionApiController.class);

    private final TreeSessionService sessionService;

    public TreeSessionApiController(TreeSessionService sessionService) {
        this.sessionService = sessionService;
    }

    // ========== SESSIONS ==========

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listSessions() {
        List<Map<String, Object>> sessions = sessionService.listSessions().stream()
            .map(this::describeSession)
            .toList();
        return ResponseEntity.ok(sessions);
    }

    @PutMapping("/{slug}")
    public ResponseEntity<?> createSession(@PathVariable String slug, @RequestBody Map<String, Object> body) {
        try {
            String shape = Optional.ofNullable(stringField(body, "shape")).orElse("");
            TreeSession session = sessionService.createSession(slug, stringField(body, "displayName"), shape);
            return ResponseEntity.status(HttpStatus.CREATED).body(describeSession(session));
        } catch (TreeFormatException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{slug}")
    public ResponseEntity<?> getSession(@PathVariable String slug) {
        return sessionService.findSession(slug)
            .map(session -> ResponseEntity.ok((Object) describeSession(session)))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{slug}")
    public ResponseEntity<Void> deleteSession(@PathVariable String slug) {
        if (!sessionService.deleteSession(slug)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // ========== QUERIES ==========

    @GetMapping("/{slug}/nodes")
    public ResponseEntity<List<NodeSummary>> getNodes(@PathVariable String slug) {
        return sessionService.findSession(slug)
            .map(session -> ResponseEntity.ok(sessionService.getNodes(session)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{slug}/nodes/{id}")
    public ResponseEntity<NodeSummary> getNode(@PathVariable String slug, @PathVariable int id) {
        return sessionService.findSession(slug)
            .flatMap(session -> sessionService.getNode(session, id))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{slug}/layout")
    public ResponseEntity<Map<Integer, Double>> getLayout(@PathVariable String slug) {
        return sessionService.findSession(slug)
            .map(session -> ResponseEntity.ok(sessionService.computeLayout(session)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{slug}/layers/{y}/generation-indices")
    public ResponseEntity<List<Integer>> getLayerGenerationIndices(@PathVariable String slug, @PathVariable int y) {
        Optional<TreeSession> session = sessionService.findSession(slug);
        if (session.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Optional<List<Integer>> indices = session.get().read(store ->
            y >= 0 && y < store.layerCount() ? Optional.of(store.generationIndicesOfLayer(y)) : Optional.empty());
        return indices.map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    // ========== COMMANDS ==========

    @PostMapping("/{slug}/layers/{y}/nodes")
    public ResponseEntity<?> addNodeAtLayer(@PathVariable String slug, @PathVariable int y,
                                            @RequestBody Map<String, Object> body) {
        return command(slug, List.of(), session -> {
            int id = sessionService.addNodeAtLayer(session, y, parseCard(body));
            return created(session, id);
        });
    }

    @PostMapping("/{slug}/nodes/{id}/children")
    public ResponseEntity<?> addChild(@PathVariable String slug, @PathVariable int id,
                                      @RequestBody Map<String, Object> body) {
        return command(slug, List.of(id), session -> {
            int childId = sessionService.addChild(session, id, parseCard(body));
            return created(session, childId);
        });
    }

    @PostMapping("/{slug}/nodes/{id}/parent")
    public ResponseEntity<?> addParent(@PathVariable String slug, @PathVariable int id,
                                       @RequestBody Map<String, Object> body) {
        return command(slug, List.of(id), session -> {
            int parentId = sessionService.addParent(session, id, parseCard(body));
            return created(session, parentId);
        });
    }

    @PutMapping("/{slug}/nodes/{id}/children/{childId}")
    public ResponseEntity<?> linkChild(@PathVariable String slug, @PathVariable int id, @PathVariable int childId) {
        return command(slug, List.of(id, childId), session -> {
            sessionService.linkChild(session, id, childId);
            return ResponseEntity.ok(sessionService.getNode(session, id).orElseThrow());
        });
    }

    @DeleteMapping("/{slug}/nodes/{id}/children/{childId}")
    public ResponseEntity<?> unlinkChild(@PathVariable String slug, @PathVariable int id, @PathVariable int childId) {
        return command(slug, List.of(id, childId), session -> {
            sessionService.unlinkChild(session, id, childId);
            return ResponseEntity.noContent().build();
        });
    }

    @PutMapping("/{slug}/nodes/{id}/position")
    public ResponseEntity<?> moveNode(@PathVariable String slug, @PathVariable int id,
                                      @RequestBody Map<String, Object> body) {
        return command(slug, List.of(id), session -> {
            Integer x = intField(body, "x");
            if (x == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "x is required"));
            }
            sessionService.moveNode(session, id, x);
            return ResponseEntity.ok(sessionService.getNode(session, id).orElseThrow());
        });
    }

    @PutMapping("/{slug}/nodes/{id}/card")
    public ResponseEntity<?> setCard(@PathVariable String slug, @PathVariable int id,
                                     @RequestBody Map<String, Object> body) {
        return command(slug, List.of(id), session -> {
            sessionService.setCard(session, id, parseCard(body));
            return ResponseEntity.ok(sessionService.getNode(session, id).orElseThrow());
        });
    }

    @PutMapping("/{slug}/nodes/{id}/generation-indices/{giIndex}")
    public ResponseEntity<?> setGenerationIndex(@PathVariable String slug, @PathVariable int id,
                                                @PathVariable int giIndex, @RequestBody Map<String, Object> body) {
        return command(slug, List.of(id), session -> {
            Integer value = intField(body, "value");
            if (value == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "value is required"));
            }
            sessionService.setGenerationIndex(session, id, giIndex, value);
            return ResponseEntity.ok(sessionService.getNode(session, id).orElseThrow());
        });
    }

    @DeleteMapping("/{slug}/nodes/{id}")
    public ResponseEntity<?> deleteNode(@PathVariable String slug, @PathVariable int id) {
        return command(slug, List.of(id), session -> {
            sessionService.deleteNode(session, id);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{slug}/generation-definitions")
    public ResponseEntity<?> addGenerationDefinition(@PathVariable String slug, @RequestBody Map<String, Object> body) {
        return command(slug, List.of(), session -> {
            String name = stringField(body, "name");
            if (name == null || name.isBlank()) {
                return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
            }
            Integer offset = intField(body, "offset");
            sessionService.addGenerationIndexDefinition(session, name, offset != null ? offset : 0);
            return ResponseEntity.status(HttpStatus.CREATED).body(describeSession(session));
        });
    }

    @PostMapping("/{slug}/undo")
    public ResponseEntity<?> undo(@PathVariable String slug) {
        return command(slug, List.of(), session -> sessionService.undo(session)
            ? ResponseEntity.ok(describeSession(session))
            : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Nothing to undo")));
    }

    @PostMapping("/{slug}/redo")
    public ResponseEntity<?> redo(@PathVariable String slug) {
        return command(slug, List.of(), session -> sessionService.redo(session)
            ? ResponseEntity.ok(describeSession(session))
            : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Nothing to redo")));
    }

    // ========== HELPERS ==========

    /**
     * Resolve the session, 404 on an unknown session or node id, and turn rejected edits
     * or malformed request fields into 400 responses.
     */
    private ResponseEntity<?> command(String slug, List<Integer> nodeIds,
                                      Function<TreeSession, ResponseEntity<?>> action) {
        Optional<TreeSession> sessionOpt = sessionService.findSession(slug);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        TreeSession session = sessionOpt.get();
        boolean known = session.read(store -> nodeIds.stream().allMatch(store::contains));
        if (!known) {
            return ResponseEntity.notFound().build();
        }
        try {
            return action.apply(session);
        } catch (TreeEditException e) {
            log.warn("Rejected edit on '{}': {} ({})", slug, e.getMessage(), e.getViolation());
            return ResponseEntity.badRequest().body(Map.of(
                "error", e.getMessage(),
                "violation", e.getViolation().name()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<?> created(TreeSession session, int id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.getNode(session, id).orElseThrow());
    }

    private Map<String, Object> describeSession(TreeSession session) {
        return session.read(store -> {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("slug", session.getSlug());
            result.put("displayName", session.getDisplayName());
            result.put("shape", sessionService.encode(session));
            result.put("layerCount", store.layerCount());
            result.put("nodeCount", store.size());
            result.put("generationBase", store.generationSettings().getBase());
            result.put("generationDefinitions", store.generationSettings().getDefinitions());
            result.put("canUndo", session.canUndo());
            result.put("canRedo", session.canRedo());
            result.put("history", session.undoHistory());
            return result;
        });
    }

    private Card parseCard(Map<String, Object> body) {
        return new Card(stringField(body, "name"), intField(body, "birthYear"),
            intField(body, "deathYear"), stringField(body, "biography"));
    }

    /** Optional string field; any other JSON type is a client error. */
    private static String stringField(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException(key + " must be a string");
    }

    /** Optional whole-number field that must fit an int. */
    private static Integer intField(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        throw new IllegalArgumentException(key + " must be an integer");
    }
}
