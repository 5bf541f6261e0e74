package com.dcruver.coursepipeline.terminology;

import com.dcruver.coursepipeline.domain.LearningPhase;
import com.dcruver.coursepipeline.domain.TermCategory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fixed keyword tables for term classification: stop terms, category patterns and
 * learning-phase cues. Patterns are regular expressions found anywhere in the term;
 * tables are tried in declaration order and the first match wins.
 *
 * Immutable; build alternate taxonomies with {@link #toBuilder()}.
 */
public final class TerminologyTaxonomy {

    private final Set<String> stopTerms;
    private final Map<TermCategory, List<Pattern>> categoryPatterns;
    private final Map<LearningPhase, List<Pattern>> phasePatterns;

    private TerminologyTaxonomy(Builder builder) {
        this.stopTerms = Collections.unmodifiableSet(new LinkedHashSet<>(builder.stopTerms));
        this.categoryPatterns = freeze(builder.categoryPatterns);
        this.phasePatterns = freeze(builder.phasePatterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.stopTerms.addAll(stopTerms);
        categoryPatterns.forEach((category, patterns) ->
            builder.categoryPatterns.put(category, new ArrayList<>(patterns)));
        phasePatterns.forEach((phase, patterns) ->
            builder.phasePatterns.put(phase, new ArrayList<>(patterns)));
        return builder;
    }

    public static TerminologyTaxonomy defaults() {
        return builder()
            .stopTerms(
                // Japanese demonstratives and formal nouns
                "これ", "それ", "あれ", "この", "その", "あの", "こと", "もの", "ため", "など",
                "ここ", "そこ", "あそこ",
                // English function words
                "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
                "have", "has", "had", "do", "does", "did", "will", "would", "can", "could",
                "may", "might", "must", "shall", "should", "this", "that", "these", "those",
                "and", "or", "but", "not", "no", "of", "to", "in", "on", "at", "by", "for",
                "from", "with", "as", "into", "about", "than", "then", "so", "if", "it", "its",
                "we", "you", "they", "he", "she", "our", "your", "their", "his", "her",
                "them", "us", "me", "my", "what", "which", "who", "when", "where", "how",
                "all", "any", "some", "more", "most", "also", "just", "very", "there", "here")
            .category(TermCategory.TECHNICAL,
                "AI", "API", "GPT", "LLM", "DX", "IT",
                "(?i)algorithm", "(?i)software", "(?i)data", "(?i)cloud", "(?i)network",
                "(?i)security", "(?i)system", "(?i)program",
                "システム", "プログラム", "アルゴリズム", "データ", "ネットワーク", "セキュリティ", "クラウド")
            .category(TermCategory.BUSINESS,
                "業務", "効率", "生産性", "コスト", "売上", "利益", "マーケティング", "営業", "管理", "戦略", "経営",
                "(?i)business", "(?i)efficien", "(?i)productivity", "(?i)revenue", "(?i)profit",
                "(?i)marketing", "(?i)sales", "(?i)management", "(?i)strategy")
            .category(TermCategory.LEARNING,
                "学習", "教育", "研修", "トレーニング", "スキル", "知識", "理解", "習得", "実践",
                "(?i)learn", "(?i)training", "(?i)skill", "(?i)knowledge", "(?i)education", "(?i)lesson")
            .phase(LearningPhase.INTRODUCTION,
                "基本", "概要", "入門", "定義", "背景",
                "(?i)basic", "(?i)overview", "(?i)introduc", "(?i)definition", "(?i)concept", "(?i)fundamental")
            .phase(LearningPhase.UNDERSTANDING,
                "仕組み", "原理", "詳細", "構造", "理論",
                "(?i)mechanism", "(?i)principle", "(?i)architecture", "(?i)theory", "(?i)structure")
            .phase(LearningPhase.APPLICATION,
                "方法", "使い方", "活用", "実践", "事例", "応用",
                "(?i)practice", "(?i)example", "(?i)case", "(?i)usage", "(?i)workflow",
                "(?i)apply", "(?i)application", "(?i)tutorial")
            .build();
    }

    public boolean isStopTerm(String token) {
        return stopTerms.contains(token.toLowerCase(Locale.ROOT));
    }

    /**
     * First matching category, or {@link TermCategory#GENERAL}
     */
    public TermCategory categorize(String term) {
        for (Map.Entry<TermCategory, List<Pattern>> entry : categoryPatterns.entrySet()) {
            if (matchesAny(entry.getValue(), term)) {
                return entry.getKey();
            }
        }
        return TermCategory.GENERAL;
    }

    /**
     * First matching learning phase, or {@link LearningPhase#NONE}
     */
    public LearningPhase phaseOf(String term) {
        for (Map.Entry<LearningPhase, List<Pattern>> entry : phasePatterns.entrySet()) {
            if (matchesAny(entry.getValue(), term)) {
                return entry.getKey();
            }
        }
        return LearningPhase.NONE;
    }

    public Set<String> getStopTerms() {
        return stopTerms;
    }

    private static boolean matchesAny(List<Pattern> patterns, String term) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(term).find()) {
                return true;
            }
        }
        return false;
    }

    private static <K> Map<K, List<Pattern>> freeze(Map<K, List<Pattern>> source) {
        Map<K, List<Pattern>> frozen = new LinkedHashMap<>();
        source.forEach((key, patterns) -> frozen.put(key, List.copyOf(patterns)));
        return Collections.unmodifiableMap(frozen);
    }

    public static final class Builder {
        private final Set<String> stopTerms = new LinkedHashSet<>();
        private final Map<TermCategory, List<Pattern>> categoryPatterns = new LinkedHashMap<>();
        private final Map<LearningPhase, List<Pattern>> phasePatterns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder stopTerms(String... terms) {
            return stopTerms(List.of(terms));
        }

        public Builder stopTerms(Collection<String> terms) {
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    stopTerms.add(term.trim().toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        /**
         * Append patterns to a category table. Tables are consulted in the order first added.
         */
        public Builder category(TermCategory category, String... patterns) {
            if (category == TermCategory.GENERAL) {
                throw new IllegalArgumentException("GENERAL is the default category and takes no patterns");
            }
            categoryPatterns.computeIfAbsent(category, key -> new ArrayList<>()).addAll(compile(patterns));
            return this;
        }

        /**
         * Append cues to a learning-phase table. Tables are consulted in the order first added.
         */
        public Builder phase(LearningPhase phase, String... patterns) {
            if (phase == LearningPhase.NONE) {
                throw new IllegalArgumentException("NONE is the default phase and takes no cues");
            }
            phasePatterns.computeIfAbsent(phase, key -> new ArrayList<>()).addAll(compile(patterns));
            return this;
        }

        public TerminologyTaxonomy build() {
            return new TerminologyTaxonomy(this);
        }

        private static List<Pattern> compile(String... patterns) {
            List<Pattern> compiled = new ArrayList<>();
            for (String pattern : patterns) {
                try {
                    compiled.add(Pattern.compile(pattern));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid taxonomy pattern: " + pattern, e);
                }
            }
            return compiled;
        }
    }
}
