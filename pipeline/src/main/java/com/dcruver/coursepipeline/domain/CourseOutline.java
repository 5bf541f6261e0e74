package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Structured course outline supplied by the caller: the course brief plus its units and slides.
 * Units and slides are kept sorted by number.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CourseOutline {
    private final String courseName;

    // Course brief, each part optional
    private final String learnerProfile;
    private final String targetBehavior;
    private final String duration;
    private final String tone;

    @Singular
    private final List<Unit> units;

    @JsonCreator
    public CourseOutline(
            @JsonProperty("course_name") String courseName,
            @JsonProperty("learner_profile") String learnerProfile,
            @JsonProperty("target_behavior") String targetBehavior,
            @JsonProperty("duration") String duration,
            @JsonProperty("tone") String tone,
            @JsonProperty("units") List<Unit> units) {
        this.courseName = courseName;
        this.learnerProfile = learnerProfile;
        this.targetBehavior = targetBehavior;
        this.duration = duration;
        this.tone = tone;
        this.units = units == null ? List.of() : units.stream()
            .sorted(Comparator.comparingInt(Unit::getNumber))
            .toList();
    }

    public Optional<String> learnerProfile() {
        return nonBlank(learnerProfile);
    }

    public Optional<String> targetBehavior() {
        return nonBlank(targetBehavior);
    }

    public Optional<String> duration() {
        return nonBlank(duration);
    }

    public Optional<String> tone() {
        return nonBlank(tone);
    }

    public int getSlideCount() {
        return units.stream().mapToInt(unit -> unit.getSlides().size()).sum();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    @Data
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Unit {
        private final int number;
        private final String name;

        @Singular
        private final List<Slide> slides;

        @JsonCreator
        public Unit(
                @JsonProperty("number") int number,
                @JsonProperty("name") String name,
                @JsonProperty("slides") List<Slide> slides) {
            this.number = number;
            this.name = name;
            this.slides = slides == null ? List.of() : slides.stream()
                .sorted(Comparator.comparingInt(Slide::getNumber))
                .toList();
        }
    }

    @Data
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Slide {
        private final int number;
        private final String title;

        @JsonCreator
        public Slide(
                @JsonProperty("number") int number,
                @JsonProperty("title") String title) {
            this.number = number;
            this.title = title;
        }
    }
}
