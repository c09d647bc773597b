package com.raditha.cyclone.model;

/**
 * Placeholder that replaces an identifier or literal value in a normalized
 * pattern.
 *
 * @param roleClass whether the replaced leaf was an identifier or a literal
 * @param ordinal   index of the first occurrence of the original value among
 *                  the values of the same class in the enclosing pattern
 */
public record RoleToken(RoleClass roleClass, int ordinal) {

    /**
     * Class of value a role token stands for.
     */
    public enum RoleClass {
        IDENTIFIER,
        LITERAL
    }

    @Override
    public String toString() {
        return (roleClass == RoleClass.IDENTIFIER ? "ID" : "LIT") + "#" + ordinal;
    }
}
