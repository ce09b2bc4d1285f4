package io.asyncbridge.server;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

final class ReasonPhrases {
    private ReasonPhrases() {}

    private static final Map<Integer, String> PHRASES = new HashMap<>();

    static {
        PHRASES.put(100, "Continue");
        PHRASES.put(101, "Switching Protocols");
        PHRASES.put(102, "Processing");
        PHRASES.put(103, "Early Hints");
        PHRASES.put(200, "OK");
        PHRASES.put(201, "Created");
        PHRASES.put(202, "Accepted");
        PHRASES.put(203, "Non-Authoritative Information");
        PHRASES.put(204, "No Content");
        PHRASES.put(205, "Reset Content");
        PHRASES.put(206, "Partial Content");
        PHRASES.put(207, "Multi-Status");
        PHRASES.put(208, "Already Reported");
        PHRASES.put(226, "IM Used");
        PHRASES.put(300, "Multiple Choices");
        PHRASES.put(301, "Moved Permanently");
        PHRASES.put(302, "Found");
        PHRASES.put(303, "See Other");
        PHRASES.put(304, "Not Modified");
        PHRASES.put(305, "Use Proxy");
        PHRASES.put(307, "Temporary Redirect");
        PHRASES.put(308, "Permanent Redirect");
        PHRASES.put(400, "Bad Request");
        PHRASES.put(401, "Unauthorized");
        PHRASES.put(402, "Payment Required");
        PHRASES.put(403, "Forbidden");
        PHRASES.put(404, "Not Found");
        PHRASES.put(405, "Method Not Allowed");
        PHRASES.put(406, "Not Acceptable");
        PHRASES.put(407, "Proxy Authentication Required");
        PHRASES.put(408, "Request Timeout");
        PHRASES.put(409, "Conflict");
        PHRASES.put(410, "Gone");
        PHRASES.put(411, "Length Required");
        PHRASES.put(412, "Precondition Failed");
        PHRASES.put(413, "Content Too Large");
        PHRASES.put(414, "URI Too Long");
        PHRASES.put(415, "Unsupported Media Type");
        PHRASES.put(416, "Range Not Satisfiable");
        PHRASES.put(417, "Expectation Failed");
        PHRASES.put(418, "I'm a teapot");
        PHRASES.put(421, "Misdirected Request");
        PHRASES.put(422, "Unprocessable Content");
        PHRASES.put(423, "Locked");
        PHRASES.put(424, "Failed Dependency");
        PHRASES.put(425, "Too Early");
        PHRASES.put(426, "Upgrade Required");
        PHRASES.put(428, "Precondition Required");
        PHRASES.put(429, "Too Many Requests");
        PHRASES.put(431, "Request Header Fields Too Large");
        PHRASES.put(451, "Unavailable For Legal Reasons");
        PHRASES.put(500, "Internal Server Error");
        PHRASES.put(501, "Not Implemented");
        PHRASES.put(502, "Bad Gateway");
        PHRASES.put(503, "Service Unavailable");
        PHRASES.put(504, "Gateway Timeout");
        PHRASES.put(505, "HTTP Version Not Supported");
        PHRASES.put(506, "Variant Also Negotiates");
        PHRASES.put(507, "Insufficient Storage");
        PHRASES.put(508, "Loop Detected");
        PHRASES.put(510, "Not Extended");
        PHRASES.put(511, "Network Authentication Required");
    }

    static Optional<String> lookup(int status) {
        return Optional.ofNullable(PHRASES.get(status));
    }
}
