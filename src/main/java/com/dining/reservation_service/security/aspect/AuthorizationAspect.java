package com.dining.reservation_service.security.aspect;

import com.dining.reservation_service.exception.ForbiddenException;
import com.dining.reservation_service.security.Caller;
import com.dining.reservation_service.security.annotation.RequiresRole;
import jakarta.servlet.http.HttpServletRequest;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * AOP Aspect for role-based authorization on controller methods.
 * Reservation ownership is checked by ReservationService, after the record is known to exist.
 */
@Aspect
@Component
@Order(1)
public class AuthorizationAspect {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationAspect.class);

    @Before("@annotation(com.dining.reservation_service.security.annotation.RequiresRole)")
    public void checkRole(JoinPoint joinPoint) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        RequiresRole annotation = method.getAnnotation(RequiresRole.class);

        if (annotation == null) return;

        Caller caller = Caller.from(currentRequest());
        boolean allowed = Arrays.stream(annotation.value())
                .anyMatch(role -> role.equalsIgnoreCase(caller.getRole().name()));

        if (!allowed) {
            logger.warn("User {} with role {} denied access to {}", caller.getId(), caller.getRole(), method.getName());
            throw new ForbiddenException(
                    "User role " + caller.getRole().name().toLowerCase() + " is not authorized to access this route");
        }
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            throw new ForbiddenException("Authentication required");
        }
        return attributes.getRequest();
    }
}
