package com.edxbuild.transi.tabular;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns raw header cells into a usable, unique column list.
 */
final class HeaderNormalizer {

    private static final char BOM = '\uFEFF';

    private HeaderNormalizer() {
    }

    /**
     * Trims headers, drops a leading byte-order mark, names blank headers {@code Unnamed: i}
     * and suffixes repeats with {@code .1}, {@code .2}, ...
     */
    static List<String> normalize(List<String> rawHeaders) {
        List<String> result = new ArrayList<>(rawHeaders.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            String header = rawHeaders.get(i) == null ? "" : rawHeaders.get(i);
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BOM) {
                header = header.substring(1);
            }
            header = header.trim();
            if (header.isEmpty()) {
                header = "Unnamed: " + i;
            }
            String unique = header;
            int suffix = 1;
            while (!seen.add(unique)) {
                unique = header + "." + suffix++;
            }
            result.add(unique);
        }
        return result;
    }
}
