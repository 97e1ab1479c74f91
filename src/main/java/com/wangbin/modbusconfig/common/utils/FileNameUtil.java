package com.wangbin.modbusconfig.common.utils;

/**
 * 导出文件名工具类
 */
public class FileNameUtil {

    private static final String FALLBACK_NAME = "controller";

    private FileNameUtil() {
        // 工具类，防止实例化
    }

    /**
     * 只保留字母数字、空格、'-'、'_'，去掉末尾空白后空格替换为下划线
     */
    public static String safeName(String name) {
        if (name == null) {
            return FALLBACK_NAME;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_') {
                sb.append(c);
            }
        }
        String safe = sb.toString().stripTrailing().replace(' ', '_');
        return safe.isEmpty() ? FALLBACK_NAME : safe;
    }

    /**
     * 生成导出文件名，例如 modbus_Boiler_1_native.json
     */
    public static String exportFileName(String prefix, String controllerName, String dialect) {
        return prefix + "_" + safeName(controllerName) + "_" + dialect + ".json";
    }
}
