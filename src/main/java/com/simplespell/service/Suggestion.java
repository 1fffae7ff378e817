package com.simplespell.service;

/**
 * A suggested word together with its corpus frequency.
 */
public class Suggestion {

    private final String text;
    private final long frequency;

    public Suggestion(String text, long frequency) {
        this.text = text;
        this.frequency = frequency;
    }

    // --- Getters ---

    public String getText() {
        return text;
    }

    public long getFrequency() {
        return frequency;
    }

    @Override
    public String toString() {
        return "Suggestion{" +
                "text='" + text + '\'' +
                ", frequency=" + frequency +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suggestion)) return false;
        Suggestion that = (Suggestion) o;
        return frequency == that.frequency && text != null && text.equalsIgnoreCase(that.text);
    }

    @Override
    public int hashCode() {
        return text == null ? 0 : text.toLowerCase().hashCode();
    }
}
