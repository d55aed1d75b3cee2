package vn.com.fecredit.graph.mapper.model;

public final class MappingSettings {

    public static final int DEFAULT_STRING_LENGTH = 256;
    public static final String DEFAULT_ARRAY_DELIMITER = ",";

    public static final MappingSettings DEFAULTS = new MappingSettings(DEFAULT_STRING_LENGTH, DEFAULT_ARRAY_DELIMITER, false);

    private final int stringLength;
    private final String arrayDelimiter;
    private final boolean allowDynamicTags;

    public MappingSettings(int stringLength, String arrayDelimiter, boolean allowDynamicTags) {
        this.stringLength = stringLength;
        this.arrayDelimiter = arrayDelimiter == null || arrayDelimiter.isEmpty() ? DEFAULT_ARRAY_DELIMITER : arrayDelimiter;
        this.allowDynamicTags = allowDynamicTags;
    }

    public int getStringLength() { return stringLength; }

    public String getArrayDelimiter() { return arrayDelimiter; }

    public boolean isAllowDynamicTags() { return allowDynamicTags; }
}
