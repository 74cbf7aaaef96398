package io.fedfetch.http.util;

import okhttp3.FormBody;

import java.util.Map;

/**
 * Form-encodes request parameters exactly once.
 */
public final class FormEncoding {

    private FormEncoding() {
    }

    /**
     * @return {@code key=value} pairs joined by {@code &}, or null if {@code data} is null
     */
    public static String encode(Map<String, String> data) {
        if (data == null) {
            return null;
        }
        FormBody.Builder builder = new FormBody.Builder();
        for (Map.Entry<String, String> entry : data.entrySet()) {
            builder.add(entry.getKey(), entry.getValue() != null ? entry.getValue() : "");
        }
        FormBody form = builder.build();

        StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < form.size(); i++) {
            if (i > 0) {
                encoded.append('&');
            }
            encoded.append(form.encodedName(i)).append('=').append(form.encodedValue(i));
        }
        return encoded.toString();
    }
}
