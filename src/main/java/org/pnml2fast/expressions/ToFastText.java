package org.pnml2fast.expressions; // 放在 expressions 包下

/**
 * 定义将 Java 对象转换为 FAST 输入语言文本片段的接口。
 */
public interface ToFastText {

    /**
     * 将此对象转换为 FAST 文本。
     * @return 对应的 FAST 文本片段，不含结尾分号。
     */
    String toFast();
}
