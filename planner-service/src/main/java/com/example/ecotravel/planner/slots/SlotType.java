package com.example.ecotravel.planner.slots;

import com.example.ecotravel.planner.domain.Candidate;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Value types a slot can declare. Each type knows how to turn a resolved candidate into
 * its slot value.
 */
public enum SlotType {
    PLACE(Candidate.class) {
        @Override
        public Object convert(Candidate c) { return c; }
    },
    TEXT(String.class) {
        @Override
        public Object convert(Candidate c) { return c.getId().trim().toLowerCase(Locale.ROOT); }
    },
    DATE(LocalDate.class) {
        @Override
        public Object convert(Candidate c) { return LocalDate.parse(c.getId().trim()); }
    },
    NUMBER(Double.class) {
        @Override
        public Object convert(Candidate c) { return Double.valueOf(c.getId().trim()); }
    };

    private final Class<?> valueClass;

    SlotType(Class<?> valueClass) {
        this.valueClass = valueClass;
    }

    /**
     * @throws RuntimeException when the candidate id cannot be parsed as this type
     */
    public abstract Object convert(Candidate candidate);

    public boolean accepts(Object value) {
        return valueClass.isInstance(value);
    }
}
