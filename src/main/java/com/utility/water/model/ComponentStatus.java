package com.utility.water.model;

import com.utility.water.engine.ModelTrainingException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Training outcome of one model in the fitted model set")
public class ComponentStatus {

    @Schema(description = "Component state", example = "TRAINED")
    private ComponentState state;

    @Schema(description = "Why the latest fit failed, if it did", example = "INSUFFICIENT_HISTORY")
    private ModelTrainingException.Reason failureReason;

    @Schema(description = "Failure detail", example = "ARIMA(5,1,0) needs at least 12 observations, got 4")
    private String message;

    public static ComponentStatus trained() {
        return ComponentStatus.builder().state(ComponentState.TRAINED).build();
    }

    public static ComponentStatus failed(ModelTrainingException e, boolean carriedOver) {
        return ComponentStatus.builder()
                .state(carriedOver ? ComponentState.CARRIED_OVER : ComponentState.FAILED)
                .failureReason(e.getReason())
                .message(e.getMessage())
                .build();
    }
}
