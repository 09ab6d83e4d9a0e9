package com.utility.water.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI waterLeakDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Water Leak Detection API")
                        .version("1.0.0")
                        .description(
                                "Leak detection and usage forecasting over an hourly water usage series.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive a live flow reading via `POST /api/v1/leaks/detect`, optionally with the current hour's usage total\n" +
                                "2. Append the usage total to the series (truncated to the hour, last write wins)\n" +
                                "3. Retrain the ARIMA(5,1,0) forecaster, the Isolation Forest scorer and the seasonal forecaster\n" +
                                "4. Compare the live reading with the historical mean and the 1.5x leak threshold\n" +
                                "5. Return **Normal**, **Potential Leak** or **Leak Detected** with a 0-100 probability\n\n" +
                                "**Forecasting:** `GET /api/v1/usage/weekly-forecast` returns the next 7 days of predicted " +
                                "daily usage and the last 7 days of actuals.\n\n" +
                                "**Degradation:** model failures never fail a request. The forecaster falls back to the " +
                                "series mean, the other models keep serving their last good fit. See `GET /api/v1/models/status`.")
                        .contact(new Contact().name("Water Monitoring Team")));
    }
}
