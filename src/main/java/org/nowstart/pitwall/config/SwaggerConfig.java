package org.nowstart.pitwall.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("pitwall API")
                        .description("pitwall 피트스톱 전략 시뮬레이션 API 문서입니다. "
                                + "POST /api/strategy/simulate 는 레이스 조건과 컴파운드 파라미터를 받아 "
                                + "순위가 매겨진 전략, 추천 전략과 규칙 해설(rule hits)을 반환합니다.")
                        .version(buildProperties.getVersion()));
    }
}
