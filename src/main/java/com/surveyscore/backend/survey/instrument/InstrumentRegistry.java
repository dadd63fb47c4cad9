package com.surveyscore.backend.survey.instrument;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 問卷註冊表：名稱 → Instrument。
 * 建立時做一次設定自檢（區間連續 / 不重疊 / 兩端無界、題目與別名不衝突），不合格就讓啟動失敗。
 * 建好之後唯讀，可以多執行緒共用。
 */
@Slf4j
public class InstrumentRegistry {

    private final Map<String, Instrument> byName;

    public InstrumentRegistry(Collection<Instrument> instruments) {
        Map<String, Instrument> m = new LinkedHashMap<>();
        for (Instrument ins : instruments) {
            verify(ins);
            if (m.putIfAbsent(ins.name(), ins) != null) {
                throw new BandTableMisconfiguredException(ins.name(), List.of("duplicate instrument name"));
            }
            log.info("[Instruments] registered {} questions={} bands={}",
                    ins.name(), ins.questionIds().size(), ins.bands().size());
        }
        this.byName = Collections.unmodifiableMap(m);
    }

    public Instrument get(String name) {
        InstrumentKind kind = InstrumentKind.parse(name);
        Instrument ins = (kind == null) ? null : byName.get(kind.wireName());
        if (ins == null) throw new UnknownInstrumentException(name);
        return ins;
    }

    public Instrument get(InstrumentKind kind) {
        Instrument ins = byName.get(kind.wireName());
        if (ins == null) throw new UnknownInstrumentException(kind.wireName());
        return ins;
    }

    public List<Instrument> all() {
        return List.copyOf(byName.values());
    }

    /** 設定自檢：回傳所有問題，空 list 代表 OK */
    static List<String> findProblems(Instrument ins) {
        List<String> problems = new ArrayList<>();

        if (ins.questionIds().isEmpty()) problems.add("no questions");
        if (ins.questionIdSet().size() != ins.questionIds().size()) problems.add("duplicate question id");

        // 別名必須指向存在的題目，且兩個別名不能指到同一題
        Map<String, String> seenTarget = new HashMap<>();
        ins.keyAliases().forEach((external, canonical) -> {
            if (!ins.questionIdSet().contains(canonical)) {
                problems.add("alias '" + external + "' points to unknown question " + canonical);
            }
            String prev = seenTarget.putIfAbsent(canonical, external);
            if (prev != null) {
                problems.add("aliases '" + prev + "' and '" + external + "' both map to " + canonical);
            }
        });

        List<ScoreBand> bands = ins.bands();
        if (bands.isEmpty()) {
            problems.add("no bands");
            return problems;
        }
        if (!bands.get(0).unboundedBelow()) problems.add("first band must be unbounded below");
        if (!bands.get(bands.size() - 1).unboundedAbove()) problems.add("last band must be unbounded above");

        for (int i = 1; i < bands.size(); i++) {
            ScoreBand prev = bands.get(i - 1);
            ScoreBand cur = bands.get(i);
            if (prev.unboundedAbove()) {
                problems.add("band " + prev.code() + " is unbounded but not last");
                continue;
            }
            long expectedLow = (long) prev.high() + 1;
            if (cur.low() > expectedLow) problems.add("gap between " + prev.code() + " and " + cur.code());
            if (cur.low() < expectedLow) problems.add("overlap between " + prev.code() + " and " + cur.code());
        }
        return problems;
    }

    private static void verify(Instrument ins) {
        List<String> problems = findProblems(ins);
        if (!problems.isEmpty()) {
            throw new BandTableMisconfiguredException(ins.name(), problems);
        }
    }
}
