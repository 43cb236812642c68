package com.promptsmith.optimizer.controller;

import java.util.List;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.promptsmith.optimizer.dto.InputUpdateRequest;
import com.promptsmith.optimizer.dto.SessionSnapshot;
import com.promptsmith.optimizer.service.PromptOptimizationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Sessions", description = "Optimization sessions and their event logs")
public class SessionController {

  private final PromptOptimizationService promptOptimizationService;

  @GetMapping("/sessions")
  @Operation(summary = "List sessions")
  public ResponseEntity<List<SessionSnapshot>> listSessions() {
    return ResponseEntity.ok(promptOptimizationService.listSessions());
  }

  @GetMapping("/session/{sessionId}")
  @Operation(summary = "Get a session", description = "Session state including its event log")
  public ResponseEntity<SessionSnapshot> getSession(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(promptOptimizationService.getSession(sessionId));
  }

  @GetMapping(value = "/session/{sessionId}/log", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(summary = "Download a session's event log as text")
  public ResponseEntity<String> downloadLog(@PathVariable("sessionId") String sessionId) {
    String transcript = promptOptimizationService.exportLog(sessionId);
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename("session_" + sessionId + "_log.txt")
                .build()
                .toString())
        .body(transcript);
  }

  @PutMapping("/session/{sessionId}/input")
  @Operation(summary = "Replace a session's human input")
  public ResponseEntity<SessionSnapshot> updateInput(
      @PathVariable("sessionId") String sessionId, @Valid @RequestBody InputUpdateRequest request) {
    return ResponseEntity.ok(
        promptOptimizationService.updateHumanInput(sessionId, request.getInput()));
  }

  @DeleteMapping("/session/{sessionId}")
  @Operation(
      summary = "Discard a session",
      description = "Removes the session and cancels any pass still running on it")
  public ResponseEntity<Void> discard(@PathVariable("sessionId") String sessionId) {
    promptOptimizationService.discardSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
