package com.example.hybridrec.controller;

import com.example.hybridrec.dto.InteractionRequest;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.service.InteractionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 交互上报接口
 */
@RestController
@RequestMapping("/api/interactions")
@RequiredArgsConstructor
@Slf4j
public class InteractionController {

    private final InteractionService interactionService;

    @PostMapping
    public ResponseEntity<UserInteraction> track(@Valid @RequestBody InteractionRequest request) {
        log.debug("[REST API] 交互上报: userId={}, resourceId={}, type={}",
            request.getUserId(), request.getResourceId(), request.getInteractionType());

        UserInteraction interaction = interactionService.trackInteraction(
            request.getUserId(), request.getResourceId(), request.getInteractionType(), request.toContext());
        return ResponseEntity.status(HttpStatus.CREATED).body(interaction);
    }
}
