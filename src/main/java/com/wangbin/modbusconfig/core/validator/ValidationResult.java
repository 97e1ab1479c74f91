package com.wangbin.modbusconfig.core.validator;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 配置校验结果
 */
@Data
public class ValidationResult {

    @JsonProperty("is_valid")
    private boolean valid = true;

    private List<String> errors = new ArrayList<>();

    private List<String> warnings = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
        valid = false;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * 第一条错误，无错误时返回 null
     */
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
