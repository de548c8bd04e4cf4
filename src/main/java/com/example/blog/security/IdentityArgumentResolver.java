package com.example.blog.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the {@link Identity} of the current request to any handler method
 * declaring a parameter of that type. Falls back to resolving the session
 * cookie directly when {@link IdentityInterceptor} did not run.
 */
@Component
@RequiredArgsConstructor
public class IdentityArgumentResolver implements HandlerMethodArgumentResolver {

    private final AuthSessionService authSessionService;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Identity.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        HttpServletRequest req = webRequest.getNativeRequest(HttpServletRequest.class);
        Object cached = req.getAttribute(Identity.REQUEST_ATTRIBUTE);
        if (cached instanceof Identity identity) {
            return identity;
        }
        Identity identity = authSessionService.currentIdentity(req);
        req.setAttribute(Identity.REQUEST_ATTRIBUTE, identity);
        return identity;
    }
}
