package com.example.ecotravel.common.turn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One rendered message of a turn reply. {@code text} messages carry plain text,
 * {@code choices} messages additionally list selectable options, {@code data} messages
 * carry a structured payload for clients that render cards.
 */
public class ResponseMessage {
    public static final String TEXT = "text";
    public static final String CHOICES = "choices";
    public static final String DATA = "data";

    private String type;
    private String text;
    private List<String> options = new ArrayList<>();
    private Map<String, Object> data = new LinkedHashMap<>();

    public ResponseMessage() {}

    public ResponseMessage(String type, String text, List<String> options, Map<String, Object> data) {
        this.type = type;
        this.text = text;
        if (options != null) this.options = new ArrayList<>(options);
        if (data != null) this.data = new LinkedHashMap<>(data);
    }

    public static ResponseMessage text(String text) {
        return new ResponseMessage(TEXT, text, null, null);
    }

    public static ResponseMessage choices(String text, List<String> options) {
        return new ResponseMessage(CHOICES, text, options, null);
    }

    public static ResponseMessage data(Map<String, Object> data) {
        return new ResponseMessage(DATA, null, null, data);
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public List<String> getOptions() { return options; }
    public void setOptions(List<String> options) { this.options = options; }
    public Map<String, Object> getData() { return data; }
    public void setData(Map<String, Object> data) { this.data = data; }

    @Override
    public String toString() {
        return "ResponseMessage{type=" + type + ", text=" + text + ", options=" + options + "}";
    }
}
