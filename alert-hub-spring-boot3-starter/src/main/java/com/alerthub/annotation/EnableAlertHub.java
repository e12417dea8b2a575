package com.alerthub.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableAlertHub {

    /**
     * 是否启用定时维护
     */
    boolean maintenance() default true;
}
