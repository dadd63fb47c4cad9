package com.surveyscore.backend.survey.instrument;

import java.util.List;

/**
 * 三份問卷的固定定義（題目 + 分數區間 + 標籤原文）。
 * 標籤文字是資料，不是邏輯；改文字不影響分類。
 */
public final class InstrumentCatalog {

    private InstrumentCatalog() {}

    private static final int MIN = Integer.MIN_VALUE;
    private static final int MAX = Integer.MAX_VALUE;

    public static final List<String> ISMA_QUESTIONS = List.of(
            "sleep_enough", "appetite_change", "guilt_feeling", "overthinking",
            "focus_memory", "no_hobby_time", "muscle_pain", "addiction",
            "work_at_home", "enough_time", "ignore_problems", "perfectionist",
            "bad_time_estimate", "overwhelmed", "low_self_esteem", "impatient",
            "hurried", "road_rage", "competitive", "critical", "distracted",
            "low_libido", "teeth_grinding", "performance_drop"
    );

    public static final List<String> INSOMNIA_PHRASES = List.of(
            "Fall Asleep", "Stay Asleep", "Early Rising", "Sleep Satisfaction",
            "Daily Impact", "Life Quality", "Sleep Concern"
    );

    public static final List<String> FATIGUE_PHRASES = List.of(
            "Sleep Disorder", "Waking Fatigue", "Focus Issue", "Muscle Pain",
            "Body Pain", "Head Pain", "Neck Shoulder Stiffness", "Throat Pain",
            "Motion Dizziness", "Exercise Fatigue", "Eye Sensitivity", "Numb Sensation",
            "Anxiety Issue", "Restless Sleep", "Cold Sensitivity", "Stomach Upset",
            "Allergic Reaction"
    );

    /** ISMA：<= 門檻（≤5 / ≤10 / 其餘） */
    public static Instrument isma() {
        return Instrument.builder(InstrumentKind.ISMA)
                .questions(ISMA_QUESTIONS)
                .band(MIN, 5, "LOW_PROBABILITY", "Стрессээр өвчлөх магадлал бага")
                .band(6, 10, "HIGH_PROBABILITY", "Стрессээр өвчлөх магадлал өндөр")
                .band(11, MAX, "VERY_HIGH_LEVEL", "Стрессийн түвшин маш өндөр байна")
                .build();
    }

    /** Insomnia：< 門檻（<8 / <15 / <22 / 其餘），換成閉區間就是 ≤7 / ≤14 / ≤21 */
    public static Instrument insomnia() {
        Instrument.Builder b = Instrument.builder(InstrumentKind.INSOMNIA);
        INSOMNIA_PHRASES.forEach(b::phraseQuestion);
        return b
                .band(MIN, 7, "NONE", "Нойргүйдэл байхгүй")
                .band(8, 14, "MILD", "Нойргүйдлийн зэрэг бага")
                .band(15, 21, "MODERATE", "Дунд зэргийн нойргүйдэлтэй")
                .band(22, MAX, "SEVERE", "Нойргүйдлийн зэрэг хүнд явцтай")
                .build();
    }

    /** Fatigue：<= 門檻（≤10 / ≤24 / ≤51 / 其餘） */
    public static Instrument fatigue() {
        Instrument.Builder b = Instrument.builder(InstrumentKind.FATIGUE);
        FATIGUE_PHRASES.forEach(b::phraseQuestion);
        return b
                .band(MIN, 10, "BAND_A", "Архаг ядаргаатай")
                .band(11, 24, "BAND_B", "Бага зэргийн архаг ядаргаатай")
                .band(25, 51, "BAND_C", "Дунд зэргийн архаг ядаргаатай")
                .band(52, MAX, "BAND_D", "Хүнд зэргийн архаг ядаргаатай")
                .build();
    }

    public static List<Instrument> defaults() {
        return List.of(isma(), insomnia(), fatigue());
    }
}
