package com.wifi.insights.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wifi.insights.dto.RoamingTrailRequest;
import com.wifi.insights.roaming.RoamingTrail;
import com.wifi.insights.service.RoamingTrailService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/** REST controller for client roaming trail reconstruction. */
@RestController
@RequestMapping("/api/roaming")
@Validated
@RequiredArgsConstructor
@Tag(name = "Roaming Trail", description = "Client mobility reconstructed from controller events")
public class RoamingTrailController {

  private final RoamingTrailService roamingTrailService;

  @PostMapping(
      value = "/trail",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Build roaming trail",
      description = "Order a client's station events and flag band steering transitions")
  public ResponseEntity<RoamingTrail> buildTrail(@Valid @RequestBody RoamingTrailRequest request) {
    return ResponseEntity.ok(roamingTrailService.buildTrail(request));
  }
}
