package me.go_gradually.ivrphone.domain.sound;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SoundCatalog {
    public static final Sound WELCOME = Sound.of("welcome", "welcome.wav", 5);
    public static final Sound EXPLANATION = Sound.of("explanation", "explanation.wav", 10);
    public static final Sound NUMBERS_NOT_FOUND = Sound.of("numbers-not-found", "numbers-not-found.wav", 5);
    public static final Sound ZERO = Sound.of("zero", "zero.wav", 5);
    public static final Sound ONE = Sound.of("one", "one.wav", 5);
    public static final Sound TWO = Sound.of("two", "two.wav", 5);
    public static final Sound THREE = Sound.of("three", "three.wav", 5);
    public static final Sound FOUR = Sound.of("four", "four.wav", 5);
    public static final Sound FIVE = Sound.of("five", "five.wav", 5);
    public static final Sound SIX = Sound.of("six", "six.wav", 5);
    public static final Sound SEVEN = Sound.of("seven", "seven.wav", 5);
    public static final Sound EIGHT = Sound.of("eight", "eight.wav", 5);
    public static final Sound NINE = Sound.of("nine", "nine.wav", 5);

    private static final List<Sound> DIGITS = List.of(ZERO, ONE, TWO, THREE, FOUR, FIVE, SIX, SEVEN, EIGHT, NINE);
    private static final Map<Character, Sound> SOUND_BY_DIGIT = indexDigits();

    private SoundCatalog() {
    }

    /**
     * Digit sounds ordered 0 to 9.
     */
    public static List<Sound> digitSounds() {
        return DIGITS;
    }

    public static Map<Character, Sound> soundsByDigit() {
        return SOUND_BY_DIGIT;
    }

    public static Sound forDigit(char digit) {
        return SOUND_BY_DIGIT.get(digit);
    }

    public static List<Sound> values() {
        return List.of(WELCOME, EXPLANATION, NUMBERS_NOT_FOUND,
                ZERO, ONE, TWO, THREE, FOUR, FIVE, SIX, SEVEN, EIGHT, NINE);
    }

    private static Map<Character, Sound> indexDigits() {
        Map<Character, Sound> byDigit = new LinkedHashMap<>();
        for (int i = 0; i < DIGITS.size(); i += 1) {
            byDigit.put(Character.forDigit(i, 10), DIGITS.get(i));
        }
        return Map.copyOf(byDigit);
    }
}
