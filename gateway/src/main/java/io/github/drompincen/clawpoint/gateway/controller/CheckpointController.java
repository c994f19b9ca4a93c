package io.github.drompincen.clawpoint.gateway.controller;

import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointConfig;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointTuple;
import io.github.drompincen.clawpoint.protocol.checkpoint.InvalidConfigException;
import io.github.drompincen.clawpoint.protocol.checkpoint.ListOptions;
import io.github.drompincen.clawpoint.protocol.checkpoint.TaskWrite;
import io.github.drompincen.clawpoint.runtime.checkpoint.SqliteCheckpointSaver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/threads/{threadId}/checkpoints")
public class CheckpointController {

    private final SqliteCheckpointSaver checkpointSaver;

    public CheckpointController(SqliteCheckpointSaver checkpointSaver) {
        this.checkpointSaver = checkpointSaver;
    }

    @GetMapping
    public List<CheckpointTuple> list(@PathVariable String threadId,
                                      @RequestParam(required = false) String ns,
                                      @RequestParam(required = false) Integer limit,
                                      @RequestParam(required = false) String before,
                                      @RequestParam(required = false) String source,
                                      @RequestParam(required = false) Integer step) {
        Map<String, Object> filter = new LinkedHashMap<>();
        if (source != null) filter.put("source", source);
        if (step != null) filter.put("step", step);
        ListOptions options = new ListOptions(limit,
                before != null ? CheckpointConfig.of(threadId, ns, before) : null, filter);
        return checkpointSaver.list(CheckpointConfig.of(threadId, ns, null), options).toList();
    }

    @GetMapping("/latest")
    public ResponseEntity<CheckpointTuple> latest(@PathVariable String threadId,
                                                  @RequestParam(required = false) String ns) {
        return checkpointSaver.getTuple(CheckpointConfig.of(threadId, ns, null))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{checkpointId}")
    public ResponseEntity<CheckpointTuple> get(@PathVariable String threadId,
                                               @PathVariable String checkpointId,
                                               @RequestParam(required = false) String ns) {
        return checkpointSaver.getTuple(CheckpointConfig.of(threadId, ns, checkpointId))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{checkpointId}/writes")
    public List<TaskWrite> writes(@PathVariable String threadId,
                                  @PathVariable String checkpointId,
                                  @RequestParam(required = false) String ns) {
        return checkpointSaver.getWrites(CheckpointConfig.of(threadId, ns, checkpointId));
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteThread(@PathVariable String threadId) {
        checkpointSaver.deleteThread(threadId);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(InvalidConfigException.class)
    public ResponseEntity<Map<String, String>> invalidConfig(InvalidConfigException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
