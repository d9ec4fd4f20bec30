package org.distributed.agentmesh.controller.registration;

import org.distributed.agentmesh.common.response.MeshResponseCode;
import org.distributed.agentmesh.common.response.MeshResponseDto;
import org.distributed.agentmesh.heartbeat.RegistrationService;
import org.distributed.agentmesh.heartbeat.RegistrationStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/registration")
public class RegistrationController {

    @Resource
    private RegistrationService registrationService;

    @GetMapping("/status")
    public ResponseEntity<RegistrationStatus> status() {
        return ResponseEntity.ok(registrationService.status());
    }

    /**
     * Register now instead of waiting for the loop
     */
    @PostMapping("/register")
    public ResponseEntity<MeshResponseDto<RegistrationStatus>> register() {
        log.info("[RegistrationController] Manual registration trigger");
        if (!registrationService.register()) {
            return ResponseEntity.ok(MeshResponseDto.error(MeshResponseCode.REGISTRY_UNAVAILABLE));
        }
        return ResponseEntity.ok(MeshResponseDto.success(registrationService.status()));
    }
}
