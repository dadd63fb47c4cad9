package com.surveyscore.backend.survey.instrument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一份問卷的定義：題目（canonical id，有順序）、外部 key 別名表、分數區間表。
 * 啟動時建立，之後不可變。
 */
public final class Instrument {

    private final InstrumentKind kind;
    private final List<String> questionIds;
    private final Set<String> questionIdSet;
    private final Map<String, String> keyAliases;
    private final List<ScoreBand> bands;

    private Instrument(InstrumentKind kind, List<String> questionIds, Map<String, String> keyAliases, List<ScoreBand> bands) {
        this.kind = kind;
        this.questionIds = List.copyOf(questionIds);
        this.questionIdSet = Collections.unmodifiableSet(new LinkedHashSet<>(questionIds));
        this.keyAliases = Collections.unmodifiableMap(new LinkedHashMap<>(keyAliases));
        this.bands = List.copyOf(bands);
    }

    public static Builder builder(InstrumentKind kind) {
        return new Builder(kind);
    }

    public InstrumentKind kind() { return kind; }

    public String name() { return kind.wireName(); }

    public List<String> questionIds() { return questionIds; }

    public Set<String> questionIdSet() { return questionIdSet; }

    public Map<String, String> keyAliases() { return keyAliases; }

    public List<ScoreBand> bands() { return bands; }

    /**
     * 外部 key → canonical id。
     * 別名表優先；本身就是 canonical id 也接受；其他一律 empty（交給 validator 當 unexpected）。
     */
    public Optional<String> canonicalize(String externalKey) {
        if (externalKey == null) return Optional.empty();
        String alias = keyAliases.get(externalKey);
        if (alias != null) return Optional.of(alias);
        if (questionIdSet.contains(externalKey)) return Optional.of(externalKey);
        return Optional.empty();
    }

    /** App 端實際送出的 key：有別名就用別名，沒有就是 canonical id 本身 */
    public List<String> externalKeys() {
        if (keyAliases.isEmpty()) return questionIds;
        List<String> out = new ArrayList<>(keyAliases.keySet());
        for (String q : questionIds) {
            if (!keyAliases.containsValue(q)) out.add(q);
        }
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "Instrument[" + name() + ", questions=" + questionIds.size() + ", bands=" + bands.size() + "]";
    }

    public static final class Builder {
        private final InstrumentKind kind;
        private final List<String> questionIds = new ArrayList<>();
        private final Map<String, String> keyAliases = new LinkedHashMap<>();
        private final List<ScoreBand> bands = new ArrayList<>();

        private Builder(InstrumentKind kind) {
            this.kind = kind;
        }

        public Builder question(String canonicalId) {
            questionIds.add(canonicalId);
            return this;
        }

        public Builder questions(List<String> canonicalIds) {
            questionIds.addAll(canonicalIds);
            return this;
        }

        /** 例如 "Fall Asleep" → fall_asleep */
        public Builder phraseQuestion(String phrase) {
            String canonical = snakeCase(phrase);
            questionIds.add(canonical);
            keyAliases.put(phrase, canonical);
            return this;
        }

        public Builder band(int low, int high, String code, String label) {
            bands.add(new ScoreBand(low, high, code, label));
            return this;
        }

        public Instrument build() {
            return new Instrument(kind, questionIds, keyAliases, bands);
        }
    }

    /** 小寫 + 空白轉底線，和原本資料表欄位命名一致 */
    static String snakeCase(String phrase) {
        return phrase.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
