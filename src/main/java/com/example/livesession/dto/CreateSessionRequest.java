package com.example.livesession.dto;

import com.example.livesession.model.QuestionType;
import com.example.livesession.model.SessionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * New session with its question sequence. Question and option ids are optional;
 * missing ones are generated.
 */
public record CreateSessionRequest(
        @Size(max = 200) String name,
        @Valid SessionSettings settings,
        @NotEmpty @Valid List<QuestionInput> questions
) {

    public record QuestionInput(
            String id,
            @NotNull QuestionType type,
            @NotBlank @Size(max = 2000) String text,
            @Valid List<OptionInput> options,
            List<String> acceptedAnswers,
            @DecimalMin("-90") @DecimalMax("90") Double targetLatitude,
            @DecimalMin("-180") @DecimalMax("180") Double targetLongitude,
            @DecimalMin("0") Double acceptanceRadiusMeters,
            @Min(0) Integer points,
            @Min(0) @Max(3600) Integer timeLimitSeconds,
            String hintText,
            String explanation
    ) { }

    public record OptionInput(String id, @NotBlank String text, boolean correct, Integer displayOrder) { }
}
