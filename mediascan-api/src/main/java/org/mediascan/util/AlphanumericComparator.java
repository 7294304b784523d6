package org.mediascan.util;

import java.util.Comparator;

/**
 * Natural order: runs of digits compare by numeric value, everything else by character code.
 * {@code null} sorts before any string.
 */
public final class AlphanumericComparator implements Comparator<String> {

    public static final AlphanumericComparator INSTANCE = new AlphanumericComparator();

    private AlphanumericComparator() {
    }

    @Override
    public int compare(String left, String right) {
        if (left == null) {
            return right == null ? 0 : -1;
        }
        if (right == null) {
            return 1;
        }

        int leftIndex = 0;
        int rightIndex = 0;
        int leftLength = left.length();
        int rightLength = right.length();

        while (leftIndex < leftLength && rightIndex < rightLength) {
            char leftChar = left.charAt(leftIndex);
            char rightChar = right.charAt(rightIndex);

            if (Character.isDigit(leftChar) && Character.isDigit(rightChar)) {
                int leftStart = skipZeros(left, leftIndex);
                int rightStart = skipZeros(right, rightIndex);
                leftIndex = skipDigits(left, leftStart);
                rightIndex = skipDigits(right, rightStart);

                // longer run without leading zeros is the larger number
                int lengthCompare = Integer.compare(leftIndex - leftStart, rightIndex - rightStart);
                if (lengthCompare != 0) {
                    return lengthCompare;
                }
                for (int i = 0; i < leftIndex - leftStart; i++) {
                    int digitCompare = Character.compare(left.charAt(leftStart + i), right.charAt(rightStart + i));
                    if (digitCompare != 0) {
                        return digitCompare;
                    }
                }
            } else {
                int compare = Character.compare(leftChar, rightChar);
                if (compare != 0) {
                    return compare;
                }
                leftIndex++;
                rightIndex++;
            }
        }

        return Integer.compare(leftLength - leftIndex, rightLength - rightIndex);
    }

    private static int skipZeros(String value, int index) {
        while (index < value.length() - 1 && value.charAt(index) == '0' && Character.isDigit(value.charAt(index + 1))) {
            index++;
        }
        return index;
    }

    private static int skipDigits(String value, int index) {
        while (index < value.length() && Character.isDigit(value.charAt(index))) {
            index++;
        }
        return index;
    }
}
