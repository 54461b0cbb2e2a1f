package com.synthetic.solvency.api;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import com.synthetic.solvency.domain.port.CallerIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads the caller from the {@value #CALLER_HEADER} header of the current request.
 */
@Component
public class HeaderCallerIdentityResolver implements CallerIdentityResolver {

    public static final String CALLER_HEADER = "X-Caller-Id";

    @Override
    public String currentCaller() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            throw new SolvencyException(SolvencyErrorCode.NOT_AUTHORIZED, "no request bound to the current thread");
        }
        HttpServletRequest request = servletAttributes.getRequest();
        String caller = request.getHeader(CALLER_HEADER);
        if (caller == null || caller.isBlank()) {
            throw new SolvencyException(SolvencyErrorCode.NOT_AUTHORIZED, CALLER_HEADER + " header is required");
        }
        return caller.trim();
    }
}
