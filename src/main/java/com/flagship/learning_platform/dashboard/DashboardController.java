package com.flagship.learning_platform.dashboard;

import com.flagship.learning_platform.dashboard.dto.MyCoursesResponse;
import com.flagship.learning_platform.dashboard.dto.OverviewResponse;
import com.flagship.learning_platform.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/overview")
    public ResponseEntity<OverviewResponse> overview(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(OverviewResponse.from(dashboardService.overview(userId)));
    }

    @GetMapping("/my-courses")
    public ResponseEntity<MyCoursesResponse> myCourses(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(MyCoursesResponse.from(dashboardService.myCourses(userId)));
    }
}
