package com.example.studydesign.controller;

import com.example.studydesign.dto.mapper.ProjectResponseMapper;
import com.example.studydesign.dto.request.CalculateDesignRequest;
import com.example.studydesign.dto.response.DesignCalculationResponse;
import com.example.studydesign.service.StudyProjectService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Stateless design calculation: no project is created and nothing is persisted.
 */
@RestController
@RequestMapping("/api/v1/design")
@RequiredArgsConstructor
@Slf4j
public class DesignCalculatorController {

    private final StudyProjectService projectService;

    @PostMapping("/calculate")
    public ResponseEntity<Map<String, Object>> calculate(@RequestBody CalculateDesignRequest request) {
        log.debug("Stateless design calculation: cvIntra={}, halfLifeHours={}", request.cvIntra(), request.halfLifeHours());

        StudyProjectService.DesignCalculation calculation = projectService.calculate(request.toDesignInput());
        DesignCalculationResponse response = new DesignCalculationResponse(
            ProjectResponseMapper.toResponse(calculation.design()),
            ProjectResponseMapper.toResponse(calculation.verdict()));

        return ResponseEntity.ok(Map.of(
            "data", response,
            "timestamp", Instant.now().toString()
        ));
    }
}
