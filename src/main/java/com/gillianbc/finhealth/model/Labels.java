package com.gillianbc.finhealth.model;

final class Labels {

    private Labels() {
    }

    // "extremely_high" -> "Extremely High"
    static String titleCase(String snakeCase) {
        StringBuilder sb = new StringBuilder();
        for (String word : snakeCase.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
