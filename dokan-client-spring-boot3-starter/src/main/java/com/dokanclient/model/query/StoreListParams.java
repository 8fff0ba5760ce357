package com.dokanclient.model.query;

import com.dokanclient.annotation.QueryParam;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StoreListParams extends ListParams {

    @QueryParam(value = "featured", omitEmpty = false)
    private Boolean featured;

    @QueryParam(value = "enabled", omitEmpty = false)
    private Boolean enabled;
}
