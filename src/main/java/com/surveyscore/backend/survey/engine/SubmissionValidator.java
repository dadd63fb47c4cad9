package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 回答 key 集合必須跟題目集合「完全相等」：不能少、不能多。
 * 純函式，沒有狀態。
 */
public class SubmissionValidator {

    private final boolean rejectNegativeResponses;

    public SubmissionValidator(boolean rejectNegativeResponses) {
        this.rejectNegativeResponses = rejectNegativeResponses;
    }

    public ValidatedSubmission validate(Map<String, Integer> responses, Instrument instrument) {
        Map<String, Integer> raw = (responses == null) ? Map.of() : responses;

        List<String> unexpected = new ArrayList<>();
        List<String> duplicate = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        // canonical id → 送進來的原始 key（用來抓兩個 key 指到同一題）
        Map<String, String> sourceKey = new HashMap<>();
        Map<String, Integer> byCanonical = new HashMap<>();

        for (Map.Entry<String, Integer> e : raw.entrySet()) {
            Optional<String> canonical = instrument.canonicalize(e.getKey());
            if (canonical.isEmpty()) {
                unexpected.add(e.getKey());
                continue;
            }
            String id = canonical.get();
            String prev = sourceKey.putIfAbsent(id, e.getKey());
            if (prev != null) {
                if (!duplicate.contains(id)) duplicate.add(id);
                continue;
            }

            Integer v = e.getValue();
            if (v == null || (rejectNegativeResponses && v < 0)) {
                invalid.add(id);
            }
            byCanonical.put(id, v);
        }

        List<String> missing = new ArrayList<>();
        for (String q : instrument.questionIds()) {
            if (!byCanonical.containsKey(q)) missing.add(q);
        }

        if (!missing.isEmpty() || !unexpected.isEmpty() || !duplicate.isEmpty() || !invalid.isEmpty()) {
            unexpected.sort(Comparator.nullsFirst(Comparator.naturalOrder()));
            throw new SubmissionValidationException(instrument.name(), missing, unexpected, duplicate, invalid);
        }

        // 依題目順序排好
        LinkedHashMap<String, Integer> ordered = new LinkedHashMap<>();
        for (String q : instrument.questionIds()) {
            ordered.put(q, byCanonical.get(q));
        }
        return new ValidatedSubmission(instrument, ordered);
    }
}
