package org.pnml2fast.expressions; // 放在 expressions 包下

public enum RelationType {

    /**
     * 运算符枚举，符号即 FAST 语法中的写法
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("=");    // Equal
    // NEQ("!="); // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
