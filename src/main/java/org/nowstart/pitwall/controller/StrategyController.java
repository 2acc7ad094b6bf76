package org.nowstart.pitwall.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.pitwall.data.dto.SimulateRequest;
import org.nowstart.pitwall.data.dto.SimulateResponse;
import org.nowstart.pitwall.service.StrategySimulationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/strategy")
@Tag(name = "Strategy", description = "피트스톱 전략 시뮬레이션 API")
public class StrategyController {

    private final StrategySimulationService strategySimulationService;

    public StrategyController(StrategySimulationService strategySimulationService) {
        this.strategySimulationService = strategySimulationService;
    }

    @PostMapping("/simulate")
    @Operation(summary = "전략 시뮬레이션", description = "컴파운드 열화 파라미터와 레이스/날씨 조건으로 피트스톱 전략을 시뮬레이션하고 순위와 룰 히트를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "시뮬레이션 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "합법적인 전략 없음 또는 컴파운드 데이터 부족")
    })
    public SimulateResponse simulate(@RequestBody @Valid SimulateRequest request) {
        return strategySimulationService.simulate(request);
    }
}
