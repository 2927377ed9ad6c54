package com.finopsguard.parser;

import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.IacFormat;

/**
 * Parser for one IaC format.
 */
public interface IacFormatParser {

    IacFormat getFormat();

    /**
     * @throws ParseException when the text is structurally malformed
     */
    CanonicalResourceModel parse(String rawText);
}
