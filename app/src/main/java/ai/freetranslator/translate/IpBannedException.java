package ai.freetranslator.translate;

import ai.freetranslator.http.TransportException;

/**
 * The service refused the request at the protocol level, which in practice means the caller's IP address has been
 * blocked or sent to a captcha page.
 */
public class IpBannedException extends TranslationException {

    public IpBannedException(TransportException cause) {
        super("The translation service rejected the request; the IP address is probably banned", cause);
    }
}
