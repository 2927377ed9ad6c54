package com.finopsguard.parser;

import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.IacFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the parser dispatch: raw IaC text plus a format tag in,
 * canonical resource model out.
 */
@Service
@Slf4j
public class IacParser {

    private final Map<IacFormat, IacFormatParser> parsers;

    public IacParser(List<IacFormatParser> formatParsers) {
        this.parsers = formatParsers.stream()
                .collect(Collectors.toMap(IacFormatParser::getFormat, Function.identity()));
    }

    public CanonicalResourceModel parse(String iacFormat, String rawText) {
        return parse(IacFormat.fromValue(iacFormat), rawText);
    }

    public CanonicalResourceModel parse(IacFormat format, String rawText) {
        IacFormatParser parser = parsers.get(format);
        if (parser == null) {
            throw new IllegalArgumentException("No parser available for format: " + format.getValue());
        }
        if (rawText == null || rawText.isBlank()) {
            return CanonicalResourceModel.empty();
        }
        CanonicalResourceModel model = parser.parse(rawText);
        log.info("Parsed {} input into {} resources", format.getValue(), model.size());
        return model;
    }
}
