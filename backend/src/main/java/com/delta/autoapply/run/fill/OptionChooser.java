package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.model.AnswerIntent;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks the option that expresses a yes or no answer. Radio groups, selects and chip
 * buttons each use a slightly different vocabulary.
 */
public final class OptionChooser {
    private static final Pattern RADIO_YES = Pattern.compile("\\b(yes|i am|authorized|do not require)\\b");
    private static final Pattern RADIO_NO = Pattern.compile("\\b(no|i do not|not|will not)\\b");
    private static final Pattern SELECT_YES = Pattern.compile("yes|authorized|citizen|do not require");
    private static final Pattern SELECT_NO = Pattern.compile("no|not|will not|do not");
    private static final Pattern CHIP_YES = Pattern.compile("\\b(yes|authorized|citizen|do not require)\\b");
    private static final Pattern CHIP_NO = Pattern.compile("\\b(no|not|will not|do not)\\b");

    private OptionChooser() {
    }

    /**
     * Index of the first radio/checkbox label matching the intent, falling back to the
     * first option. -1 only when there are no options.
     */
    public static int chooseRadioIndex(List<String> optionTexts, AnswerIntent intent) {
        if (optionTexts == null || optionTexts.isEmpty()) {
            return -1;
        }
        Pattern wanted = intent == AnswerIntent.YES ? RADIO_YES : RADIO_NO;
        for (int i = 0; i < optionTexts.size(); i++) {
            if (wanted.matcher(normalize(optionTexts.get(i))).find()) {
                return i;
            }
        }
        return 0;
    }

    public static Optional<String> chooseSelectLabel(List<String> optionLabels, AnswerIntent intent) {
        if (optionLabels == null) {
            return Optional.empty();
        }
        Pattern wanted = intent == AnswerIntent.YES ? SELECT_YES : SELECT_NO;
        return optionLabels.stream()
            .filter(label -> label != null && wanted.matcher(normalize(label)).find())
            .findFirst();
    }

    public static boolean chipMatches(String chipText, AnswerIntent intent) {
        Pattern wanted = intent == AnswerIntent.YES ? CHIP_YES : CHIP_NO;
        return wanted.matcher(normalize(chipText)).find();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
