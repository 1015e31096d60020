package com.github.tarcv.phppcre;

public enum PcreErrorCode {
    /*
     * Codes in the range 0x10100-0x101ff are reserved for errors in the delimited pattern envelope.
     */
    PATTERN_ERROR_START(0x10100),
    PATTERN_MISSING_DELIMITER,            /**< No delimiter before the first alphanumeric or backslash.  */
    PATTERN_UNTERMINATED,                 /**< The closing delimiter does not occur after the opening one. */
    MODIFIER_UNRECOGNIZED,                /**< Unknown modifier letter after the closing delimiter.      */
    MODIFIER_UNSUPPORTED,                 /**< Known modifier that changes semantics not modelled here.  */
    /*
     * Codes in the range 0x10300-0x103ff are reserved for regular expression related errors.
     */
    REGEX_ERROR_START(0x10300),
    REGEX_RULE_SYNTAX,                    /**< Syntax error in regexp pattern.                    */
    REGEX_BAD_ESCAPE_SEQUENCE,            /**< Unrecognized backslash escape sequence in pattern  */
    REGEX_PROPERTY_SYNTAX,                /**< Incorrect Unicode property                         */
    REGEX_UNIMPLEMENTED,                  /**< Use of regexp feature that is not supported.       */
    REGEX_MISMATCHED_PAREN,               /**< Incorrectly nested parentheses in regexp pattern.  */
    REGEX_NUMBER_TOO_BIG,                 /**< Decimal number is too large.                       */
    REGEX_BAD_INTERVAL,                   /**< Error in {min,max} interval                        */
    REGEX_MAX_LT_MIN,                     /**< In {min,max}, max is less than min.                */
    REGEX_INVALID_FLAG,                   /**< Invalid inline flag in a (?flags) group.           */
    REGEX_EMPTY_ALTERNATE,                /**< An alternative next to a '|' is empty.             */
    REGEX_MISSING_CLOSE_BRACKET,          /**< Missing closing bracket on a bracket expression.   */
    REGEX_INVALID_RANGE,                  /**< In a character range [x-y], x is greater than y.   */
    REGEX_INVALID_CAPTURE_GROUP_NAME,     /**< Invalid or duplicate capture group name.           */
    /*
     * Codes in the range 0x10400-0x104ff are reserved for errors while interrogating a compiled tree.
     */
    EXTRACT_ERROR_START(0x10400),
    GROUP_NOT_FOUND,                      /**< No capturing group with the requested index.       */
    GROUP_STRUCTURE,                      /**< The group's body is not a set of single characters. */
    CHARACTER_SET_STRUCTURE,              /**< A node that cannot be enumerated as characters.    */
    ;

    private final int index;

    PcreErrorCode(final int index) {
        this.index = index;
    }

    PcreErrorCode() {
        this.index = -1;
    }

    public int getIndex() {
        if (index >= 0) {
            return index;
        } else {
            return PcreErrorCode.values()[ordinal() - 1].getIndex() + 1;
        }
    }
}
