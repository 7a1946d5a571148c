package org.bimexport.level;

import org.bimexport.model.ModelElement;

import java.util.Locale;

/**
 * 构件在空间结构中的组合类型（IfcElementCompositionEnum）。
 */
public enum ElementCompositionType {
    COMPLEX,
    ELEMENT,
    PARTIAL;

    /**
     * 覆盖参数名。
     */
    public static final String OVERRIDE_NAME = "IfcElementCompositionType";

    /**
     * 读取构件上的覆盖参数；未设置或取值无法识别时为 {@link #ELEMENT}。
     */
    public static ElementCompositionType resolve(ModelElement element) {
        String value = element.override(OVERRIDE_NAME);
        if (value == null || value.isBlank()) {
            return ELEMENT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ElementCompositionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return ELEMENT;
    }
}
