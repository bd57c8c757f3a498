package com.jreinhal.tieredrag.controller;

import com.jreinhal.tieredrag.kb.KnowledgeBaseService;
import com.jreinhal.tieredrag.kb.KnowledgeBaseService.KnowledgeBaseCreateRequest;
import com.jreinhal.tieredrag.kb.KnowledgeBaseService.KnowledgeBaseSummary;
import com.jreinhal.tieredrag.kb.KnowledgeBaseService.KnowledgeBaseUpdateRequest;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Knowledge Bases")
@RequestMapping(value={"/api/kb"})
public class KnowledgeBaseController {
    private final KnowledgeBaseService knowledgeBaseService;

    public KnowledgeBaseController(KnowledgeBaseService knowledgeBaseService) {
        this.knowledgeBaseService = knowledgeBaseService;
    }

    @PostMapping
    public ResponseEntity<KnowledgeBaseSummary> create(@RequestBody KnowledgeBaseCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(this.knowledgeBaseService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<KnowledgeBaseSummary>> list() {
        return ResponseEntity.ok(this.knowledgeBaseService.list());
    }

    @GetMapping("/{name}")
    public ResponseEntity<KnowledgeBaseSummary> get(@PathVariable String name) {
        return ResponseEntity.ok(this.knowledgeBaseService.get(name));
    }

    @PutMapping("/{name}")
    public ResponseEntity<KnowledgeBaseSummary> update(@PathVariable String name,
                                                       @RequestBody KnowledgeBaseUpdateRequest request) {
        return ResponseEntity.ok(this.knowledgeBaseService.update(name, request));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<DeletionResponse> delete(@PathVariable String name) {
        long chunks = this.knowledgeBaseService.delete(name);
        return ResponseEntity.ok(new DeletionResponse(name, chunks));
    }

    public record DeletionResponse(String name, long chunksDeleted) {
    }
}
