package com.example.hybridrec.controller;

import com.example.hybridrec.dto.ProfileResponse;
import com.example.hybridrec.dto.ProfileUpdateRequest;
import com.example.hybridrec.entity.UserProfile;
import com.example.hybridrec.service.UserProfileService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 用户画像接口
 */
@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ProfileController {

    private final UserProfileService profileService;

    @GetMapping
    public ResponseEntity<ProfileResponse> get(@RequestParam @NotBlank String userId) {
        return ResponseEntity.ok(profileService.toResponse(profileService.getOrCreateProfile(userId)));
    }

    @PutMapping
    public ResponseEntity<ProfileResponse> update(@Valid @RequestBody ProfileUpdateRequest request) {
        log.info("[REST API] 更新画像: userId={}", request.getUserId());
        UserProfile profile = profileService.updateProfileSettings(request.getUserId(), request);
        return ResponseEntity.ok(profileService.toResponse(profile));
    }
}
