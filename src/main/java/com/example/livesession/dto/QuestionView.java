package com.example.livesession.dto;

import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionOption;
import com.example.livesession.model.QuestionType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** Participant-safe question: no correctness flags, no accepted answers, no target. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionView(String id, QuestionType type, String text, List<OptionView> options, String hintText) {

    public static QuestionView of(Question q) {
        List<OptionView> opts = new ArrayList<>();
        for (QuestionOption o : q.participantOptions()) {
            opts.add(new OptionView(o.id(), o.text(), o.displayOrder()));
        }
        return new QuestionView(q.id(), q.type(), q.text(), List.copyOf(opts), q.hintText());
    }

    public record OptionView(String id, String text, int displayOrder) { }
}
